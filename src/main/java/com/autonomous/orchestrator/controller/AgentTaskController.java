package com.autonomous.orchestrator.controller;

import com.autonomous.orchestrator.model.AgentTask;
import com.autonomous.orchestrator.service.AgentOrchestrationService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/agents")
public class AgentTaskController {

    @Autowired
    private AgentOrchestrationService orchestrator;

    @GetMapping("/status")
    public ResponseEntity<?> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("running", orchestrator.isRunning());
        body.put("queueLength", orchestrator.getQueueLength());
        body.put("currentTask", orchestrator.getCurrentTask().orElse(null));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/tasks/queued")
    public List<AgentTask> queuedTasks() {
        return orchestrator.getQueuedTasks();
    }

    @GetMapping("/tasks/active")
    public List<AgentTask> activeTasks() {
        return orchestrator.getActiveTasks();
    }

    @GetMapping("/tasks/completed")
    public List<AgentTask> completedTasks() {
        return orchestrator.getCompletedTasks();
    }

    @DeleteMapping("/tasks/completed")
    public ResponseEntity<?> clearHistory() {
        orchestrator.clearHistory();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/tasks/{taskId}")
    public ResponseEntity<AgentTask> task(@PathVariable String taskId) {
        return orchestrator.getTask(taskId)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/tasks/{taskId}/start")
    public ResponseEntity<?> start(@PathVariable String taskId) {
        orchestrator.start(taskId);
        return currentState(taskId);
    }

    @PostMapping("/tasks/{taskId}/pause")
    public ResponseEntity<?> pause(@PathVariable String taskId) {
        orchestrator.pause(taskId);
        return currentState(taskId);
    }

    @PostMapping("/tasks/{taskId}/resume")
    public ResponseEntity<?> resume(@PathVariable String taskId) {
        orchestrator.resume(taskId);
        return currentState(taskId);
    }

    @PostMapping("/tasks/{taskId}/cancel")
    public ResponseEntity<?> cancel(@PathVariable String taskId,
                                    @RequestParam(required = false) String reason) {
        orchestrator.cancel(taskId, reason);
        return currentState(taskId);
    }

    private ResponseEntity<?> currentState(String taskId) {
        return orchestrator.getTask(taskId)
            .<ResponseEntity<?>>map(task -> ResponseEntity.ok(Map.of(
                "taskId", task.getId(),
                "status", task.getStatus())))
            .orElse(ResponseEntity.accepted().build());
    }
}
