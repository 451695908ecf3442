package com.autonomous.orchestrator.model;

import java.time.Instant;

/**
 * Notification emitted by the orchestrator. {@code task} is a snapshot taken at emission time.
 */
public record AgentTaskEvent(AgentTaskEventType type, AgentTask task, String message, Instant emittedAt) {

    public String taskId() {
        return task.getId();
    }
}
