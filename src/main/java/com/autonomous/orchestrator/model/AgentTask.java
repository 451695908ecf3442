package com.autonomous.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * One scheduled invocation of a file agent, with its live counters.
 *
 * <p>Progress is tracked on two independent axes: items for agents that count files and
 * bytes for agents that move or hash data. Percentages, elapsed time and ETA are derived on
 * every read and never stored.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AgentTask {

    private static final String NO_ESTIMATE = "--:--";

    @Builder.Default
    private String id = UUID.randomUUID().toString();

    @Builder.Default
    private String agentName = "";

    private AgentType agentType;

    @Builder.Default
    private String description = "";

    @Builder.Default
    private String currentAction = "";

    @Builder.Default
    private AgentTaskStatus status = AgentTaskStatus.PENDING;

    @Builder.Default
    private AgentTaskPriority priority = AgentTaskPriority.NORMAL;

    @Builder.Default
    private Instant createdAt = Instant.now();

    private Instant startedAt;
    private Instant completedAt;

    private int totalItems;
    private int processedItems;
    private int failedItems;
    private long totalBytes;
    private long processedBytes;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    private String cancellationReason;

    @Builder.Default
    private boolean canCancel = true;

    @Builder.Default
    private boolean canPause = true;

    // Time source for the live views; the orchestrator swaps in its own clock on submit
    @JsonIgnore
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @Builder.Default
    private Clock clock = Clock.systemUTC();

    public double getProgressPercentage() {
        return percentage(processedItems, totalItems);
    }

    public double getBytesPercentage() {
        return percentage(processedBytes, totalBytes);
    }

    public Duration getElapsedTime() {
        return getElapsedTime(Instant.now(clock));
    }

    /**
     * Elapsed running time as seen at {@code now}; frozen at {@code completedAt} once terminal.
     */
    public Duration getElapsedTime(Instant now) {
        if (startedAt == null) {
            return Duration.ZERO;
        }
        Instant end = completedAt != null ? completedAt : now;
        Duration elapsed = Duration.between(startedAt, end);
        return elapsed.isNegative() ? Duration.ZERO : elapsed;
    }

    public Optional<Duration> getEstimatedTimeRemaining() {
        return getEstimatedTimeRemaining(Instant.now(clock));
    }

    /**
     * Linear extrapolation from the average item rate so far. Bursty agents will see the
     * estimate jump around; there is no smoothing window.
     */
    public Optional<Duration> getEstimatedTimeRemaining(Instant now) {
        if (startedAt == null || processedItems == 0 || totalItems == 0) {
            return Optional.empty();
        }

        double elapsedSeconds = getElapsedTime(now).toMillis() / 1000.0;
        double itemsPerSecond = processedItems / elapsedSeconds;
        if (!Double.isFinite(itemsPerSecond) || itemsPerSecond <= 0) {
            return Optional.empty();
        }

        int remainingItems = Math.max(0, totalItems - processedItems);
        return Optional.of(Duration.ofMillis(Math.round(remainingItems / itemsPerSecond * 1000)));
    }

    public String getProgressText() {
        return String.format(Locale.US, "%,d / %,d", processedItems, totalItems);
    }

    public String getElapsedTimeText() {
        return formatDuration(getElapsedTime());
    }

    public String getEtaText() {
        return getEstimatedTimeRemaining().map(AgentTask::formatDuration).orElse(NO_ESTIMATE);
    }

    /**
     * Deep copy handed to observers so later mutations never leak into a published view.
     */
    public AgentTask snapshot() {
        return toBuilder()
            .errors(new ArrayList<>(errors))
            .metadata(new LinkedHashMap<>(metadata))
            .build();
    }

    public static String formatDuration(Duration duration) {
        long totalSeconds = Math.max(0, duration.getSeconds());
        long hours = totalSeconds / 3600;
        long minutes = (totalSeconds % 3600) / 60;
        long seconds = totalSeconds % 60;

        if (hours >= 1) {
            return String.format("%02d:%02d:%02d", hours, minutes, seconds);
        }
        return String.format("%02d:%02d", minutes, seconds);
    }

    private static double percentage(double processed, double total) {
        if (total <= 0) {
            return 0;
        }
        double rounded = Math.round(processed / total * 1000) / 10.0;
        return Math.min(100.0, Math.max(0.0, rounded));
    }
}
