package com.autonomous.orchestrator.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wiring for the orchestrator's clock and the pool that runs agent units of work.
 */
@Configuration
public class OrchestratorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Cached pool: only one task holds the running slot, but a cancelled unit of work that
     * ignores the signal may still be finishing when the next one starts.
     */
    @Bean(name = "agentWorkerExecutor", destroyMethod = "shutdownNow")
    public ExecutorService agentWorkerExecutor() {
        return Executors.newCachedThreadPool(new AgentThreadFactory());
    }

    private static class AgentThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "agent-worker-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
