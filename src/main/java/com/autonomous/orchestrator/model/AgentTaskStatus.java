package com.autonomous.orchestrator.model;

public enum AgentTaskStatus {
    PENDING,
    QUEUED,
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Whether a task in this status holds the single running slot.
     */
    public boolean occupiesSlot() {
        return this == RUNNING || this == PAUSED;
    }
}
