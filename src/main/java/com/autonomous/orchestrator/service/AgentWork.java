package com.autonomous.orchestrator.service;

/**
 * The opaque unit of work behind a task (a duplicate scan, a batch rename, a backup).
 * Implementations report through the context and are expected to poll it for pause and
 * cancel requests; the orchestrator never preempts them.
 *
 * <p>Returning normally completes the task and throwing fails it with the exception message,
 * unless the work already settled the task through the context.
 */
@FunctionalInterface
public interface AgentWork {
    void run(AgentTaskContext context) throws Exception;
}
