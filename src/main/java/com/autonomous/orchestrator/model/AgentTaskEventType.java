package com.autonomous.orchestrator.model;

public enum AgentTaskEventType {
    QUEUED,
    UPDATED,
    COMPLETED
}
