package com.autonomous.orchestrator.exception;

/**
 * Base for structural errors raised synchronously by the orchestrator before any state changes.
 */
public abstract class AgentTaskException extends RuntimeException {

    private final String taskId;

    protected AgentTaskException(String taskId, String message) {
        super(message);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
