package com.autonomous.orchestrator.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AgentStatusTickerTest {

    @Mock
    private AgentOrchestrationService orchestrator;

    @Test
    void shouldPublishRunningStatusOnTick() {
        AgentStatusTicker ticker = new AgentStatusTicker(orchestrator);

        ticker.tick();
        ticker.tick();

        verify(orchestrator, times(2)).publishRunningStatus();
    }

    @Test
    void shouldKeepTickingAfterFailure() {
        doThrow(new IllegalStateException("boom")).doNothing().when(orchestrator).publishRunningStatus();
        AgentStatusTicker ticker = new AgentStatusTicker(orchestrator);

        assertDoesNotThrow(ticker::tick);
        assertDoesNotThrow(ticker::tick);

        verify(orchestrator, times(2)).publishRunningStatus();
    }
}
