package com.autonomous.orchestrator.exception;

public class InvalidTaskArgumentException extends AgentTaskException {

    public InvalidTaskArgumentException(String taskId, String message) {
        super(taskId, message);
    }
}
