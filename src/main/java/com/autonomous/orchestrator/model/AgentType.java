package com.autonomous.orchestrator.model;

public enum AgentType {
    FILE_DISCOVERY,
    CLASSIFICATION,
    ORGANIZATION,
    CLEANUP,
    SEARCH,
    MONITOR,
    BATCH_RENAME,
    DUPLICATE,
    SPACE_RECOVERY,
    BACKUP,
    RESTORE
}
