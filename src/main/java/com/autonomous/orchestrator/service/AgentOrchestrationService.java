package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.exception.InvalidTaskArgumentException;
import com.autonomous.orchestrator.exception.InvalidTaskStateException;
import com.autonomous.orchestrator.exception.TaskNotFoundException;
import com.autonomous.orchestrator.model.AgentTask;
import com.autonomous.orchestrator.model.AgentTaskEvent;
import com.autonomous.orchestrator.model.AgentTaskEventType;
import com.autonomous.orchestrator.model.AgentTaskStatus;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Owns every agent task for the lifetime of the process and runs them one at a time.
 *
 * <p>A single task occupies the running slot (Running or Paused); everything else waits in a
 * priority queue, highest priority first and FIFO within a priority. All collections are
 * guarded by one lock. Events are appended to the publisher's outbox inside the lock and
 * delivered after it is released, and units of work are launched after it is released too.
 */
@Slf4j
@Service
public class AgentOrchestrationService {

    static final String DEFAULT_CANCEL_REASON = "Cancelled by user";
    static final String SHUTDOWN_CANCEL_REASON = "Orchestrator shutting down";
    static final String DEFAULT_FAILURE_MESSAGE = "Task reported failure";

    private static final Comparator<TaskHandle> DISPATCH_ORDER = Comparator
        .comparing((TaskHandle h) -> h.task.getPriority()).reversed()
        .thenComparing(h -> h.task.getCreatedAt())
        .thenComparingLong(h -> h.sequence);

    private final AgentTaskEventPublisher publisher;
    private final Executor workerExecutor;
    private final Clock clock;
    private final int historyLimit;
    private final boolean autoDispatch;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, TaskHandle> handles = new HashMap<>();
    private final PriorityQueue<TaskHandle> waitQueue = new PriorityQueue<>(DISPATCH_ORDER);
    private final LinkedHashMap<String, AgentTask> history = new LinkedHashMap<>();
    private TaskHandle current;
    private TaskHandle runNext;
    private long sequence;
    private boolean accepting = true;

    @Autowired
    public AgentOrchestrationService(AgentTaskEventPublisher publisher,
                                     @Qualifier("agentWorkerExecutor") Executor workerExecutor,
                                     Clock clock,
                                     @Value("${agent.orchestrator.history-limit:50}") int historyLimit,
                                     @Value("${agent.orchestrator.auto-dispatch:true}") boolean autoDispatch) {
        if (historyLimit < 1) {
            throw new IllegalArgumentException("agent.orchestrator.history-limit must be positive: " + historyLimit);
        }
        this.publisher = publisher;
        this.workerExecutor = workerExecutor;
        this.clock = clock;
        this.historyLimit = historyLimit;
        this.autoDispatch = autoDispatch;
    }

    public String submit(AgentTask task) {
        return submit(task, null);
    }

    /**
     * Queues a task and, when the slot is free, starts it before returning. Never waits on work.
     *
     * @param work optional unit of work launched when the task is promoted; without one the
     *             caller drives progress and completion itself
     */
    public String submit(AgentTask task, AgentWork work) {
        Objects.requireNonNull(task, "task");
        String id = task.getId() == null || task.getId().isBlank() ? UUID.randomUUID().toString() : task.getId();
        validateTask(id, task);

        List<TaskHandle> launches = new ArrayList<>();
        lock.lock();
        try {
            if (!accepting) {
                throw new InvalidTaskStateException(id, "Orchestrator is shut down and no longer accepts tasks");
            }
            if (handles.containsKey(id) || history.containsKey(id)) {
                throw new InvalidTaskArgumentException(id, "Task id already in use: " + id);
            }
            if (task.getStatus() != AgentTaskStatus.PENDING) {
                throw new InvalidTaskArgumentException(id, "Only pending tasks can be submitted, got " + task.getStatus());
            }

            AgentTask owned = task.snapshot();
            owned.setId(id);
            owned.setStatus(AgentTaskStatus.QUEUED);
            owned.setClock(clock);

            TaskHandle handle = new TaskHandle(owned, work, new AgentTaskContext(id, this), sequence++);
            handles.put(id, handle);
            waitQueue.add(handle);

            log.info("Agent task queued: {} - {}", owned.getAgentName(), owned.getDescription());
            emit(AgentTaskEventType.QUEUED, owned, null);
            promoteNextLocked(launches);
        } finally {
            lock.unlock();
        }
        afterUnlock(launches);
        return id;
    }

    /**
     * Runs a specific queued task now, out of priority order. While another task holds the slot
     * the task is pinned instead and starts as soon as the slot frees up; a later start
     * request replaces the pin.
     */
    public void start(String taskId) {
        List<TaskHandle> launches = new ArrayList<>();
        lock.lock();
        try {
            TaskHandle handle = requireLiveHandleLocked(taskId);
            if (handle.task.getStatus() != AgentTaskStatus.QUEUED) {
                throw new TaskNotFoundException(taskId,
                    "No startable task: " + taskId + " is " + handle.task.getStatus());
            }
            if (current != null) {
                runNext = handle;
                log.info("Agent task pinned to run next: {} - {}", handle.task.getAgentName(), handle.task.getDescription());
                emit(AgentTaskEventType.UPDATED, handle.task, "Task will run next");
            } else {
                waitQueue.remove(handle);
                if (runNext == handle) {
                    runNext = null;
                }
                startLocked(handle, launches);
            }
        } finally {
            lock.unlock();
        }
        afterUnlock(launches);
    }

    public void pause(String taskId) {
        lock.lock();
        try {
            TaskHandle handle = requireLiveHandleLocked(taskId);
            AgentTask task = handle.task;
            if (!task.isCanPause()) {
                throw new InvalidTaskStateException(taskId, "Task cannot be paused: " + task.getAgentName());
            }
            if (task.getStatus() != AgentTaskStatus.RUNNING) {
                throw new InvalidTaskStateException(taskId, "Only running tasks can be paused, got " + task.getStatus());
            }
            task.setStatus(AgentTaskStatus.PAUSED);
            handle.context.requestPause();

            log.info("Agent task paused: {}", task.getAgentName());
            emit(AgentTaskEventType.UPDATED, task, "Task paused");
        } finally {
            lock.unlock();
        }
        publisher.flush();
    }

    public void resume(String taskId) {
        lock.lock();
        try {
            TaskHandle handle = requireLiveHandleLocked(taskId);
            AgentTask task = handle.task;
            if (!task.isCanPause()) {
                throw new InvalidTaskStateException(taskId, "Task cannot be paused: " + task.getAgentName());
            }
            if (task.getStatus() != AgentTaskStatus.PAUSED) {
                throw new InvalidTaskStateException(taskId, "Only paused tasks can be resumed, got " + task.getStatus());
            }
            task.setStatus(AgentTaskStatus.RUNNING);
            handle.context.clearPause();

            log.info("Agent task resumed: {}", task.getAgentName());
            emit(AgentTaskEventType.UPDATED, task, "Task resumed");
        } finally {
            lock.unlock();
        }
        publisher.flush();
    }

    public void cancel(String taskId) {
        cancel(taskId, null);
    }

    /**
     * Cancels a queued, running or paused task. Running work only receives a signal; if it
     * ignores the signal it keeps running while the task is already recorded as cancelled.
     */
    public void cancel(String taskId, String reason) {
        List<TaskHandle> launches = new ArrayList<>();
        lock.lock();
        try {
            TaskHandle handle = requireLiveHandleLocked(taskId);
            if (!handle.task.isCanCancel()) {
                throw new InvalidTaskStateException(taskId, "Task cannot be cancelled: " + handle.task.getAgentName());
            }
            cancelLocked(handle, reason == null || reason.isBlank() ? DEFAULT_CANCEL_REASON : reason, launches);
        } finally {
            lock.unlock();
        }
        afterUnlock(launches);
    }

    /**
     * Marks a running task completed. {@code success == false} records a failure instead.
     */
    public void complete(String taskId, boolean success, String message) {
        if (!success) {
            fail(taskId, message == null || message.isBlank() ? DEFAULT_FAILURE_MESSAGE : message);
            return;
        }

        List<TaskHandle> launches = new ArrayList<>();
        lock.lock();
        try {
            TaskHandle handle = requireLiveHandleLocked(taskId);
            requireRunning(handle);
            finishLocked(handle, AgentTaskStatus.COMPLETED, message == null ? "Task completed" : message, launches);
        } finally {
            lock.unlock();
        }
        afterUnlock(launches);
    }

    /**
     * Records an agent failure on a running task. The failure is data, not an error for the caller.
     */
    public void fail(String taskId, String errorMessage) {
        List<TaskHandle> launches = new ArrayList<>();
        lock.lock();
        try {
            TaskHandle handle = requireLiveHandleLocked(taskId);
            requireRunning(handle);
            String message = errorMessage == null || errorMessage.isBlank() ? DEFAULT_FAILURE_MESSAGE : errorMessage;
            handle.task.getErrors().add(message);
            finishLocked(handle, AgentTaskStatus.FAILED, message, launches);
        } finally {
            lock.unlock();
        }
        afterUnlock(launches);
    }

    /**
     * @return {@code false} when the task is unknown or not running; those calls are ignored
     */
    public boolean updateProgress(String taskId, int processedItems, String currentAction) {
        if (processedItems < 0) {
            throw new InvalidTaskArgumentException(taskId, "Processed items cannot be negative: " + processedItems);
        }
        lock.lock();
        try {
            AgentTask task = runningTaskLocked(taskId);
            if (task == null) {
                return false;
            }
            task.setProcessedItems(processedItems);
            applyCurrentAction(task, currentAction);
            emit(AgentTaskEventType.UPDATED, task, null);
        } finally {
            lock.unlock();
        }
        publisher.flush();
        return true;
    }

    public boolean updateProgressBytes(String taskId, long processedBytes, String currentAction) {
        if (processedBytes < 0) {
            throw new InvalidTaskArgumentException(taskId, "Processed bytes cannot be negative: " + processedBytes);
        }
        lock.lock();
        try {
            AgentTask task = runningTaskLocked(taskId);
            if (task == null) {
                return false;
            }
            task.setProcessedBytes(processedBytes);
            applyCurrentAction(task, currentAction);
            emit(AgentTaskEventType.UPDATED, task, null);
        } finally {
            lock.unlock();
        }
        publisher.flush();
        return true;
    }

    /**
     * Counts one item the agent could not process, keeping the error for diagnostics.
     */
    public boolean reportItemFailure(String taskId, String error) {
        lock.lock();
        try {
            TaskHandle handle = handles.get(taskId);
            if (handle == null || !handle.task.getStatus().occupiesSlot()) {
                return false;
            }
            AgentTask task = handle.task;
            task.setFailedItems(task.getFailedItems() + 1);
            if (error != null && !error.isBlank()) {
                task.getErrors().add(error);
            }
            emit(AgentTaskEventType.UPDATED, task, error);
        } finally {
            lock.unlock();
        }
        publisher.flush();
        return true;
    }

    /**
     * Re-emits "updated" for the running task so observers can refresh elapsed time and ETA.
     */
    public void publishRunningStatus() {
        lock.lock();
        try {
            if (current == null || current.task.getStatus() != AgentTaskStatus.RUNNING) {
                return;
            }
            emit(AgentTaskEventType.UPDATED, current.task, null);
        } finally {
            lock.unlock();
        }
        publisher.flush();
    }

    public Optional<AgentTask> getTask(String taskId) {
        lock.lock();
        try {
            TaskHandle handle = handles.get(taskId);
            if (handle != null) {
                return Optional.of(handle.task.snapshot());
            }
            AgentTask finished = history.get(taskId);
            return Optional.ofNullable(finished).map(AgentTask::snapshot);
        } finally {
            lock.unlock();
        }
    }

    public Optional<AgentTask> getCurrentTask() {
        lock.lock();
        try {
            return Optional.ofNullable(current).map(h -> h.task.snapshot());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Tasks holding the running slot: at most one, Running or Paused.
     */
    public List<AgentTask> getActiveTasks() {
        return getCurrentTask().map(List::of).orElse(List.of());
    }

    /**
     * Waiting tasks in the order they would be promoted, a pinned task first.
     */
    public List<AgentTask> getQueuedTasks() {
        lock.lock();
        try {
            List<AgentTask> queued = new ArrayList<>(waitQueue.size());
            if (runNext != null) {
                queued.add(runNext.task.snapshot());
            }
            waitQueue.stream()
                .filter(h -> h != runNext)
                .sorted(DISPATCH_ORDER)
                .forEach(h -> queued.add(h.task.snapshot()));
            return queued;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Finished tasks, most recent first.
     */
    public List<AgentTask> getCompletedTasks() {
        lock.lock();
        try {
            List<AgentTask> completed = new ArrayList<>(history.size());
            for (AgentTask task : history.values()) {
                completed.add(0, task.snapshot());
            }
            return completed;
        } finally {
            lock.unlock();
        }
    }

    public int getQueueLength() {
        lock.lock();
        try {
            return waitQueue.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunning() {
        lock.lock();
        try {
            return current != null;
        } finally {
            lock.unlock();
        }
    }

    public void clearHistory() {
        lock.lock();
        try {
            log.debug("Clearing {} completed agent tasks", history.size());
            history.clear();
        } finally {
            lock.unlock();
        }
    }

    public void subscribe(AgentTaskEventType type, String subscriberId, Consumer<AgentTaskEvent> listener) {
        publisher.subscribe(type, subscriberId, listener);
    }

    public void unsubscribe(AgentTaskEventType type, String subscriberId) {
        publisher.unsubscribe(type, subscriberId);
    }

    /**
     * Stops accepting submissions and cancels everything still queued or running.
     */
    @PreDestroy
    public void shutdown() {
        lock.lock();
        try {
            if (!accepting) {
                return;
            }
            accepting = false;
            List<TaskHandle> live = new ArrayList<>(waitQueue);
            if (current != null) {
                live.add(0, current);
            }
            for (TaskHandle handle : live) {
                cancelLocked(handle, SHUTDOWN_CANCEL_REASON, new ArrayList<>());
            }
            log.info("Agent orchestrator shut down, cancelled {} tasks", live.size());
        } finally {
            lock.unlock();
        }
        publisher.flush();
    }

    private void promoteNextLocked(List<TaskHandle> launches) {
        if (!accepting || current != null) {
            return;
        }
        TaskHandle next;
        if (runNext != null) {
            next = runNext;
            runNext = null;
            waitQueue.remove(next);
        } else if (autoDispatch) {
            next = waitQueue.poll();
        } else {
            return;
        }
        if (next != null) {
            startLocked(next, launches);
        }
    }

    private void startLocked(TaskHandle handle, List<TaskHandle> launches) {
        AgentTask task = handle.task;
        task.setStatus(AgentTaskStatus.RUNNING);
        if (task.getStartedAt() == null) {
            task.setStartedAt(now());
        }
        current = handle;
        launches.add(handle);

        log.info("Agent task started: {} - {}", task.getAgentName(), task.getDescription());
        emit(AgentTaskEventType.UPDATED, task, "Task started");
    }

    private void cancelLocked(TaskHandle handle, String reason, List<TaskHandle> launches) {
        AgentTask task = handle.task;
        task.setCancellationReason(reason);
        task.setStatus(AgentTaskStatus.CANCELLED);
        task.setCompletedAt(now());
        handle.context.requestCancel();
        waitQueue.remove(handle);
        if (runNext == handle) {
            runNext = null;
        }

        log.info("Agent task cancelled: {} - {}", task.getAgentName(), reason);
        emit(AgentTaskEventType.UPDATED, task, "Task cancelled");
        retireLocked(handle);
        emit(AgentTaskEventType.COMPLETED, task, "Task cancelled");
        promoteNextLocked(launches);
    }

    private void finishLocked(TaskHandle handle, AgentTaskStatus outcome, String message, List<TaskHandle> launches) {
        AgentTask task = handle.task;
        task.setStatus(outcome);
        task.setCompletedAt(now());
        retireLocked(handle);

        if (outcome == AgentTaskStatus.FAILED) {
            log.error("Agent task failed: {} - {}", task.getAgentName(), message);
        } else {
            log.info("Agent task completed: {} - {}/{} items",
                task.getAgentName(), task.getProcessedItems(), task.getTotalItems());
        }
        emit(AgentTaskEventType.COMPLETED, task, message);
        promoteNextLocked(launches);
    }

    private void retireLocked(TaskHandle handle) {
        handles.remove(handle.task.getId());
        if (current == handle) {
            current = null;
        }
        history.put(handle.task.getId(), handle.task);
        Iterator<String> oldest = history.keySet().iterator();
        while (history.size() > historyLimit && oldest.hasNext()) {
            oldest.next();
            oldest.remove();
        }
    }

    /**
     * Settles a task after its unit of work returned or threw, unless something else already did.
     */
    private void settleAfterWork(TaskHandle handle, Exception failure) {
        List<TaskHandle> launches = new ArrayList<>();
        lock.lock();
        try {
            if (current != handle || !handle.task.getStatus().occupiesSlot()) {
                if (failure != null) {
                    log.debug("Ignoring failure from settled agent task {}: {}", handle.task.getId(), failure.getMessage());
                }
                return;
            }
            if (handle.task.getStatus() == AgentTaskStatus.PAUSED) {
                // work ended without waiting for resume; leave the pause through Running
                handle.task.setStatus(AgentTaskStatus.RUNNING);
                handle.context.clearPause();
                emit(AgentTaskEventType.UPDATED, handle.task, "Task resumed");
            }
            if (failure == null) {
                finishLocked(handle, AgentTaskStatus.COMPLETED, "Task completed", launches);
            } else {
                String message = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
                handle.task.getErrors().add(message);
                finishLocked(handle, AgentTaskStatus.FAILED, message, launches);
            }
        } finally {
            lock.unlock();
        }
        afterUnlock(launches);
    }

    private void afterUnlock(List<TaskHandle> launches) {
        publisher.flush();
        for (TaskHandle handle : launches) {
            launch(handle);
        }
    }

    private void launch(TaskHandle handle) {
        if (handle.work == null) {
            return;
        }
        workerExecutor.execute(() -> {
            try {
                handle.work.run(handle.context);
                settleAfterWork(handle, null);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                settleAfterWork(handle, e);
            } catch (Exception e) {
                settleAfterWork(handle, e);
            }
        });
    }

    private TaskHandle requireLiveHandleLocked(String taskId) {
        TaskHandle handle = handles.get(taskId);
        if (handle != null) {
            return handle;
        }
        AgentTask finished = history.get(taskId);
        if (finished != null) {
            throw new InvalidTaskStateException(taskId, "Task already finished: " + finished.getStatus());
        }
        throw new TaskNotFoundException(taskId);
    }

    private AgentTask runningTaskLocked(String taskId) {
        TaskHandle handle = handles.get(taskId);
        if (handle == null || handle.task.getStatus() != AgentTaskStatus.RUNNING) {
            return null;
        }
        return handle.task;
    }

    private static void requireRunning(TaskHandle handle) {
        AgentTaskStatus status = handle.task.getStatus();
        if (status != AgentTaskStatus.RUNNING) {
            throw new InvalidTaskStateException(handle.task.getId(), "Task is not running: " + status);
        }
    }

    private static void applyCurrentAction(AgentTask task, String currentAction) {
        if (currentAction != null && !currentAction.isEmpty()) {
            task.setCurrentAction(currentAction);
        }
    }

    private static void validateTask(String id, AgentTask task) {
        if (task.getPriority() == null || task.getCreatedAt() == null) {
            throw new InvalidTaskArgumentException(id, "Task priority and creation time are required");
        }
        if (task.getTotalItems() < 0 || task.getProcessedItems() < 0 || task.getFailedItems() < 0
                || task.getTotalBytes() < 0 || task.getProcessedBytes() < 0) {
            throw new InvalidTaskArgumentException(id, "Task counters cannot be negative");
        }
    }

    private void emit(AgentTaskEventType type, AgentTask task, String message) {
        publisher.enqueue(new AgentTaskEvent(type, task.snapshot(), message, now()));
    }

    private Instant now() {
        return Instant.now(clock);
    }

    private static final class TaskHandle {
        private final AgentTask task;
        private final AgentWork work;
        private final AgentTaskContext context;
        private final long sequence;

        private TaskHandle(AgentTask task, AgentWork work, AgentTaskContext context, long sequence) {
            this.task = task;
            this.work = work;
            this.context = context;
            this.sequence = sequence;
        }
    }
}
