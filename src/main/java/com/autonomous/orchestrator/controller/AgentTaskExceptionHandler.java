package com.autonomous.orchestrator.controller;

import com.autonomous.orchestrator.exception.AgentTaskException;
import com.autonomous.orchestrator.exception.InvalidTaskArgumentException;
import com.autonomous.orchestrator.exception.InvalidTaskStateException;
import com.autonomous.orchestrator.exception.TaskNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps orchestrator errors to HTTP statuses: not found 404, bad transition 409, bad input 400.
 */
@Slf4j
@RestControllerAdvice
public class AgentTaskExceptionHandler {

    @ExceptionHandler(TaskNotFoundException.class)
    public ResponseEntity<?> notFound(TaskNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "not_found", e);
    }

    @ExceptionHandler(InvalidTaskStateException.class)
    public ResponseEntity<?> invalidState(InvalidTaskStateException e) {
        return error(HttpStatus.CONFLICT, "invalid_state", e);
    }

    @ExceptionHandler(InvalidTaskArgumentException.class)
    public ResponseEntity<?> invalidArgument(InvalidTaskArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, "invalid_argument", e);
    }

    private ResponseEntity<?> error(HttpStatus status, String code, AgentTaskException e) {
        log.debug("Rejected agent task request. taskId={}, error={}", e.getTaskId(), e.getMessage());
        return ResponseEntity.status(status).body(Map.of(
            "error", code,
            "message", e.getMessage()));
    }
}
