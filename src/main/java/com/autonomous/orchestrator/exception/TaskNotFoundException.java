package com.autonomous.orchestrator.exception;

public class TaskNotFoundException extends AgentTaskException {

    public TaskNotFoundException(String taskId) {
        super(taskId, "Task not found: " + taskId);
    }

    public TaskNotFoundException(String taskId, String message) {
        super(taskId, message);
    }
}
