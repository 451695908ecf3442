package com.autonomous.orchestrator.model;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-agent defaults loaded from {@code config/agents/*.yaml}.
 */
@Data
public class AgentDefinition {
    private String name;
    private AgentType agentType;
    private String description;

    // Scheduling
    private AgentTaskPriority priority = AgentTaskPriority.NORMAL;

    // Capabilities; atomic batches such as renames usually disable pause
    private boolean canPause = true;
    private boolean canCancel = true;

    private Map<String, Object> metadata = new LinkedHashMap<>();
}
