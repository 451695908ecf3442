package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.AgentTaskEvent;
import com.autonomous.orchestrator.model.AgentTaskEventType;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Fans task events out to the queued/updated/completed subscriber channels.
 *
 * <p>The orchestrator appends events to an ordered outbox while it holds its own lock and
 * calls {@link #flush()} after releasing it. Delivery happens on the dispatch executor, one
 * drain at a time, so every subscriber sees events in the order the state changed and a slow
 * subscriber only delays other subscribers, never the orchestrator.
 */
@Slf4j
@Component
public class AgentTaskEventPublisher {

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final Map<AgentTaskEventType, ConcurrentMap<String, Consumer<AgentTaskEvent>>> subscribersByType;
    private final Queue<AgentTaskEvent> outbox = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final Executor dispatchExecutor;
    private final ExecutorService ownedExecutor;

    @Autowired
    public AgentTaskEventPublisher() {
        this(Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "agent-event-dispatcher");
            thread.setDaemon(true);
            return thread;
        }));
    }

    public AgentTaskEventPublisher(Executor dispatchExecutor) {
        this.dispatchExecutor = dispatchExecutor;
        this.ownedExecutor = dispatchExecutor instanceof ExecutorService service ? service : null;
        this.subscribersByType = new EnumMap<>(AgentTaskEventType.class);
        for (AgentTaskEventType type : AgentTaskEventType.values()) {
            subscribersByType.put(type, new ConcurrentHashMap<>());
        }
    }

    public void subscribe(AgentTaskEventType type, String subscriberId, Consumer<AgentTaskEvent> listener) {
        if (type == null || subscriberId == null || listener == null) {
            return;
        }
        subscribersByType.get(type).put(subscriberId, listener);
    }

    public void unsubscribe(AgentTaskEventType type, String subscriberId) {
        if (type == null || subscriberId == null) {
            return;
        }
        subscribersByType.get(type).remove(subscriberId);
    }

    public int subscriberCount(AgentTaskEventType type) {
        return subscribersByType.get(type).size();
    }

    /**
     * Appends an event to the outbox. Callers hold the orchestrator lock, which fixes the order.
     */
    void enqueue(AgentTaskEvent event) {
        if (event != null) {
            outbox.add(event);
        }
    }

    /**
     * Schedules delivery of everything in the outbox. Never call while holding the orchestrator lock.
     */
    void flush() {
        if (outbox.isEmpty()) {
            return;
        }
        try {
            dispatchExecutor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            log.debug("Dispatcher stopped, delivering {} pending events inline", outbox.size());
            drain();
        }
    }

    private void drain() {
        do {
            if (!draining.compareAndSet(false, true)) {
                return;
            }
            try {
                AgentTaskEvent event;
                while ((event = outbox.poll()) != null) {
                    deliver(event);
                }
            } finally {
                draining.set(false);
            }
        } while (!outbox.isEmpty());
    }

    private void deliver(AgentTaskEvent event) {
        for (Map.Entry<String, Consumer<AgentTaskEvent>> entry : subscribersByType.get(event.type()).entrySet()) {
            try {
                entry.getValue().accept(event);
            } catch (Exception ex) {
                log.warn("Agent task event dispatch failed. type={}, taskId={}, subscriberId={}, error={}",
                        event.type(), event.taskId(), entry.getKey(), ex.getMessage());
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        if (ownedExecutor == null) {
            drain();
            return;
        }
        ownedExecutor.shutdown();
        try {
            if (!ownedExecutor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Agent event dispatcher did not stop within {}s", SHUTDOWN_TIMEOUT_SECONDS);
                ownedExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ownedExecutor.shutdownNow();
        }
    }
}
