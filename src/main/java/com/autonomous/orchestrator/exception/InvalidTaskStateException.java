package com.autonomous.orchestrator.exception;

/**
 * Thrown when an operation asks for a transition the task state machine does not allow.
 */
public class InvalidTaskStateException extends AgentTaskException {

    public InvalidTaskStateException(String taskId, String message) {
        super(taskId, message);
    }
}
