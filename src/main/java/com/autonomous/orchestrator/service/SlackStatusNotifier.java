package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.AgentTask;
import com.autonomous.orchestrator.model.AgentTaskEvent;
import com.autonomous.orchestrator.model.AgentTaskEventType;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Posts queued and finished agent tasks to a Slack channel. Stays unsubscribed unless both a
 * bot token and {@code agent.notify.slack-channel} are configured.
 */
@Slf4j
@Component
public class SlackStatusNotifier {

    static final String SUBSCRIBER_ID = "slack-status-notifier";

    private final AgentOrchestrationService orchestrator;
    private final SlackService slackService;
    private final String channel;

    public SlackStatusNotifier(AgentOrchestrationService orchestrator,
                               SlackService slackService,
                               @Value("${agent.notify.slack-channel:}") String channel) {
        this.orchestrator = orchestrator;
        this.slackService = slackService;
        this.channel = channel;
    }

    @PostConstruct
    public void register() {
        if (channel == null || channel.isBlank() || !slackService.isConfigured()) {
            log.info("Slack status notifications disabled");
            return;
        }
        orchestrator.subscribe(AgentTaskEventType.QUEUED, SUBSCRIBER_ID, this::onTaskQueued);
        orchestrator.subscribe(AgentTaskEventType.COMPLETED, SUBSCRIBER_ID, this::onTaskCompleted);
        log.info("Posting agent task status to Slack channel {}", channel);
    }

    @PreDestroy
    public void unregister() {
        orchestrator.unsubscribe(AgentTaskEventType.QUEUED, SUBSCRIBER_ID);
        orchestrator.unsubscribe(AgentTaskEventType.COMPLETED, SUBSCRIBER_ID);
    }

    void onTaskQueued(AgentTaskEvent event) {
        slackService.postMessage(channel, formatQueued(event.task()));
    }

    void onTaskCompleted(AgentTaskEvent event) {
        slackService.postMessage(channel, formatFinished(event.task(), event.message()));
    }

    public String formatQueued(AgentTask task) {
        return String.format("*Queued:* %s\n%s\nPriority: %s", task.getAgentName(), task.getDescription(),
            task.getPriority());
    }

    public String formatFinished(AgentTask task, String message) {
        StringBuilder text = new StringBuilder();
        switch (task.getStatus()) {
            case COMPLETED -> text.append("*Completed:* ");
            case FAILED -> text.append("*Failed:* ");
            case CANCELLED -> text.append("*Cancelled:* ");
            default -> text.append("*Finished:* ");
        }
        text.append(task.getAgentName()).append("\n");
        text.append("*Progress:* ").append(task.getProgressText()).append(" items");
        if (task.getFailedItems() > 0) {
            text.append(" (").append(task.getFailedItems()).append(" failed)");
        }
        text.append("\n");
        text.append("*Elapsed:* ").append(task.getElapsedTimeText());

        if (task.getCancellationReason() != null) {
            text.append("\n*Reason:* ").append(task.getCancellationReason());
        } else if (message != null && !message.isBlank()) {
            text.append("\n*Message:* ").append(message);
        }
        return text.toString();
    }
}
