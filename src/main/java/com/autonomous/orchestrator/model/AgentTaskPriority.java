package com.autonomous.orchestrator.model;

/**
 * Dispatch priority, declared lowest first so natural enum order can be used for comparison.
 */
public enum AgentTaskPriority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL
}
