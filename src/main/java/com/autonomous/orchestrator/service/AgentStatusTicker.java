package com.autonomous.orchestrator.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically re-publishes the running task so elapsed time and ETA keep moving on screens
 * even when the agent reports progress rarely.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "agent.orchestrator.status-ticker-enabled", havingValue = "true", matchIfMissing = true)
public class AgentStatusTicker {

    private final AgentOrchestrationService orchestrator;

    public AgentStatusTicker(AgentOrchestrationService orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Scheduled(fixedRateString = "${agent.orchestrator.status-interval-ms:500}")
    public void tick() {
        try {
            orchestrator.publishRunningStatus();
        } catch (Exception ex) {
            log.warn("Agent status tick failed. error={}", ex.getMessage());
        }
    }
}
