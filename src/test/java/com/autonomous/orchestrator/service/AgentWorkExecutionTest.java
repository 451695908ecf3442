package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.AgentTask;
import com.autonomous.orchestrator.model.AgentTaskEvent;
import com.autonomous.orchestrator.model.AgentTaskEventType;
import com.autonomous.orchestrator.model.AgentTaskStatus;
import com.autonomous.orchestrator.model.AgentType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class AgentWorkExecutionTest {

    private ExecutorService workers;
    private AgentOrchestrationService orchestrator;
    private final List<AgentTaskEvent> events = new CopyOnWriteArrayList<>();
    private final Map<String, CountDownLatch> finished = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() {
        workers = Executors.newCachedThreadPool();
        orchestrator = new AgentOrchestrationService(
            new AgentTaskEventPublisher(Runnable::run), workers, Clock.systemUTC(), 50, true);
        for (AgentTaskEventType type : AgentTaskEventType.values()) {
            orchestrator.subscribe(type, "recorder", events::add);
        }
        orchestrator.subscribe(AgentTaskEventType.COMPLETED, "latches",
            e -> latchFor(e.taskId()).countDown());
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    private CountDownLatch latchFor(String taskId) {
        return finished.computeIfAbsent(taskId, id -> new CountDownLatch(1));
    }

    private void awaitFinished(String taskId) throws InterruptedException {
        assertTrue(latchFor(taskId).await(5, TimeUnit.SECONDS), "task did not finish: " + taskId);
    }

    private AgentTask task(String id, int totalItems) {
        return AgentTask.builder()
            .id(id)
            .agentName(id)
            .agentType(AgentType.FILE_DISCOVERY)
            .totalItems(totalItems)
            .build();
    }

    private long completedEvents(String taskId) {
        return events.stream()
            .filter(e -> e.taskId().equals(taskId) && e.type() == AgentTaskEventType.COMPLETED)
            .count();
    }

    private List<String> transitions(String taskId) {
        return events.stream()
            .filter(e -> e.taskId().equals(taskId))
            .map(e -> e.type() + ":" + e.task().getStatus())
            .collect(Collectors.toList());
    }

    @Test
    void shouldCompleteTaskWhenWorkReturns() throws Exception {
        String id = orchestrator.submit(task("discover", 3), context -> {
            for (int i = 1; i <= 3; i++) {
                context.reportProgress(i, "file-" + i);
            }
        });

        awaitFinished(id);

        AgentTask done = orchestrator.getTask(id).orElseThrow();
        assertEquals(AgentTaskStatus.COMPLETED, done.getStatus());
        assertEquals(100.0, done.getProgressPercentage());
        assertEquals("file-3", done.getCurrentAction());
        assertFalse(orchestrator.isRunning());
    }

    @Test
    void shouldFailTaskWhenWorkThrows() throws Exception {
        String id = orchestrator.submit(task("discover", 3), context -> {
            throw new IOException("disk unreadable");
        });

        awaitFinished(id);

        AgentTask failed = orchestrator.getTask(id).orElseThrow();
        assertEquals(AgentTaskStatus.FAILED, failed.getStatus());
        assertEquals(List.of("disk unreadable"), failed.getErrors());
        assertEquals(1, completedEvents(id));
    }

    @Test
    void shouldNotSettleTwiceWhenWorkCompletesItself() throws Exception {
        String id = orchestrator.submit(task("discover", 1), context -> {
            context.reportProgress(1, null);
            context.complete("Indexed 1 file");
        });

        awaitFinished(id);
        workers.shutdown();
        assertTrue(workers.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(AgentTaskStatus.COMPLETED, orchestrator.getTask(id).orElseThrow().getStatus());
        assertEquals(1, completedEvents(id));
        AgentTaskEvent completed = events.stream()
            .filter(e -> e.taskId().equals(id) && e.type() == AgentTaskEventType.COMPLETED)
            .findFirst().orElseThrow();
        assertEquals("Indexed 1 file", completed.message());
    }

    @Test
    void shouldRunQueuedWorkAfterCurrentFinishes() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        String first = orchestrator.submit(task("first", 1), context -> release.await());
        AtomicBoolean secondRan = new AtomicBoolean();
        String second = orchestrator.submit(task("second", 1), context -> secondRan.set(true));

        assertEquals(AgentTaskStatus.QUEUED, orchestrator.getTask(second).orElseThrow().getStatus());
        assertFalse(secondRan.get());

        release.countDown();
        awaitFinished(first);
        awaitFinished(second);

        assertTrue(secondRan.get());
        assertEquals(AgentTaskStatus.COMPLETED, orchestrator.getTask(second).orElseThrow().getStatus());
    }

    @Test
    void shouldStopCooperatingWorkOnCancel() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch stopped = new CountDownLatch(1);
        String id = orchestrator.submit(task("cleanup", 1000), context -> {
            started.countDown();
            int processed = 0;
            while (!context.isCancellationRequested()) {
                context.reportProgress(++processed % 1000, "Deleting temp files");
                Thread.sleep(5);
            }
            stopped.countDown();
        });

        assertTrue(started.await(5, TimeUnit.SECONDS));
        orchestrator.cancel(id, "User pressed stop");

        assertTrue(stopped.await(5, TimeUnit.SECONDS));
        AgentTask cancelled = orchestrator.getTask(id).orElseThrow();
        assertEquals(AgentTaskStatus.CANCELLED, cancelled.getStatus());
        assertEquals("User pressed stop", cancelled.getCancellationReason());
        assertEquals(1, completedEvents(id));
    }

    @Test
    void shouldPromoteNextTaskWhileIgnoredCancelKeepsRunning() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        String stubborn = orchestrator.submit(task("stubborn", 1), context -> {
            started.countDown();
            release.await();
            context.complete("finished anyway");
        });
        String next = orchestrator.submit(task("next", 1), context -> context.reportProgress(1, null));

        assertTrue(started.await(5, TimeUnit.SECONDS));
        orchestrator.cancel(stubborn, null);
        awaitFinished(next);

        assertEquals(AgentTaskStatus.COMPLETED, orchestrator.getTask(next).orElseThrow().getStatus());

        release.countDown();
        workers.shutdown();
        assertTrue(workers.awaitTermination(5, TimeUnit.SECONDS));
        assertEquals(AgentTaskStatus.CANCELLED, orchestrator.getTask(stubborn).orElseThrow().getStatus());
        assertEquals(1, completedEvents(stubborn));
    }

    @Test
    void shouldHoldWorkWhilePaused() throws Exception {
        CountDownLatch atCheckpoint = new CountDownLatch(1);
        CountDownLatch passedCheckpoint = new CountDownLatch(1);
        CountDownLatch pausedSeen = new CountDownLatch(1);
        String id = orchestrator.submit(task("organize", 2), context -> {
            context.reportProgress(1, "Moving batch 1");
            atCheckpoint.countDown();
            while (!context.isPauseRequested()) {
                Thread.sleep(5);
            }
            pausedSeen.countDown();
            if (!context.awaitResume()) {
                return;
            }
            passedCheckpoint.countDown();
            context.reportProgress(2, "Moving batch 2");
        });

        assertTrue(atCheckpoint.await(5, TimeUnit.SECONDS));
        orchestrator.pause(id);
        assertTrue(pausedSeen.await(5, TimeUnit.SECONDS));
        assertFalse(passedCheckpoint.await(100, TimeUnit.MILLISECONDS));
        assertEquals(AgentTaskStatus.PAUSED, orchestrator.getTask(id).orElseThrow().getStatus());

        orchestrator.resume(id);
        awaitFinished(id);

        AgentTask done = orchestrator.getTask(id).orElseThrow();
        assertEquals(AgentTaskStatus.COMPLETED, done.getStatus());
        assertEquals(2, done.getProcessedItems());
    }

    @Test
    void shouldReleasePausedWorkOnCancel() throws Exception {
        CountDownLatch paused = new CountDownLatch(1);
        AtomicBoolean resumedNormally = new AtomicBoolean(true);
        CountDownLatch exited = new CountDownLatch(1);
        String id = orchestrator.submit(task("backup", 10), context -> {
            while (!context.isPauseRequested()) {
                Thread.sleep(5);
            }
            paused.countDown();
            resumedNormally.set(context.awaitResume());
            exited.countDown();
        });

        orchestrator.pause(id);
        assertTrue(paused.await(5, TimeUnit.SECONDS));
        orchestrator.cancel(id, null);

        assertTrue(exited.await(5, TimeUnit.SECONDS));
        assertFalse(resumedNormally.get());
        assertEquals(AgentTaskStatus.CANCELLED, orchestrator.getTask(id).orElseThrow().getStatus());
    }

    @Test
    void shouldPassThroughRunningWhenWorkReturnsWhilePaused() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        String id = orchestrator.submit(task("rename", 5), context -> release.await());

        orchestrator.pause(id);
        release.countDown();
        awaitFinished(id);

        assertEquals(List.of(
            "QUEUED:QUEUED",
            "UPDATED:RUNNING",
            "UPDATED:PAUSED",
            "UPDATED:RUNNING",
            "COMPLETED:COMPLETED"), transitions(id));
        assertEquals(AgentTaskStatus.COMPLETED, orchestrator.getTask(id).orElseThrow().getStatus());
    }

    @Test
    void shouldPassThroughRunningWhenWorkThrowsWhilePaused() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        String id = orchestrator.submit(task("rename", 5), context -> {
            release.await();
            throw new IOException("volume unmounted");
        });

        orchestrator.pause(id);
        release.countDown();
        awaitFinished(id);

        assertEquals(List.of(
            "QUEUED:QUEUED",
            "UPDATED:RUNNING",
            "UPDATED:PAUSED",
            "UPDATED:RUNNING",
            "COMPLETED:FAILED"), transitions(id));
        AgentTask failed = orchestrator.getTask(id).orElseThrow();
        assertEquals(List.of("volume unmounted"), failed.getErrors());
    }
}
