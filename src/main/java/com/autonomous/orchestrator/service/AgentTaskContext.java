package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.AgentTask;

import java.util.Optional;

/**
 * Handle given to a running {@link AgentWork}: progress reporting back into the orchestrator
 * plus the cooperative pause and cancel signals for one task.
 */
public class AgentTaskContext {

    private final String taskId;
    private final AgentOrchestrationService orchestrator;
    private final Object signalMonitor = new Object();

    private volatile boolean cancelRequested;
    private volatile boolean pauseRequested;

    AgentTaskContext(String taskId, AgentOrchestrationService orchestrator) {
        this.taskId = taskId;
        this.orchestrator = orchestrator;
    }

    public String getTaskId() {
        return taskId;
    }

    public Optional<AgentTask> getTask() {
        return orchestrator.getTask(taskId);
    }

    public boolean reportProgress(int processedItems, String currentAction) {
        return orchestrator.updateProgress(taskId, processedItems, currentAction);
    }

    public boolean reportBytes(long processedBytes, String currentAction) {
        return orchestrator.updateProgressBytes(taskId, processedBytes, currentAction);
    }

    public boolean reportItemFailure(String error) {
        return orchestrator.reportItemFailure(taskId, error);
    }

    public void complete(String message) {
        orchestrator.complete(taskId, true, message);
    }

    public void fail(String errorMessage) {
        orchestrator.fail(taskId, errorMessage);
    }

    public boolean isCancellationRequested() {
        return cancelRequested;
    }

    public boolean isPauseRequested() {
        return pauseRequested;
    }

    /**
     * Blocks while the task is paused.
     *
     * @return {@code false} if the task was cancelled and the work should stop
     */
    public boolean awaitResume() throws InterruptedException {
        synchronized (signalMonitor) {
            while (pauseRequested && !cancelRequested) {
                signalMonitor.wait();
            }
        }
        return !cancelRequested;
    }

    void requestPause() {
        synchronized (signalMonitor) {
            pauseRequested = true;
        }
    }

    void clearPause() {
        synchronized (signalMonitor) {
            pauseRequested = false;
            signalMonitor.notifyAll();
        }
    }

    void requestCancel() {
        synchronized (signalMonitor) {
            cancelRequested = true;
            signalMonitor.notifyAll();
        }
    }
}
