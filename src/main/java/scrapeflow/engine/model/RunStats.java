package scrapeflow.engine.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Aggregate over all results of a run.
 * Totals do not depend on the order results arrived in.
 */
public record RunStats(
        int total,
        int succeeded,
        int failed,
        int records,
        Duration minProcessingTime,
        Duration meanProcessingTime,
        Duration medianProcessingTime,
        Duration p95ProcessingTime,
        Duration maxProcessingTime,
        Map<String, Integer> countsBySourceType,
        Map<String, Integer> failuresBySourceType,
        Instant startedAt,
        Instant finishedAt) {

    public RunStats {
        countsBySourceType = Map.copyOf(countsBySourceType);
        failuresBySourceType = Map.copyOf(failuresBySourceType);
    }

    public static RunStats empty(Instant startedAt) {
        return new RunStats(0, 0, 0, 0, Duration.ZERO, Duration.ZERO, Duration.ZERO, Duration.ZERO, Duration.ZERO,
                Map.of(), Map.of(), startedAt, startedAt);
    }

    /** Percentage of succeeded tasks, 0 when nothing ran. */
    public double successRate() {
        return total == 0 ? 0.0 : 100.0 * succeeded / total;
    }

    /** Wall time between run start and the last collected result. */
    public Duration wallTime() {
        if (startedAt == null || finishedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt);
    }

    @Override
    public String toString() {
        return "RunStats{total=%d, succeeded=%d, failed=%d, records=%d, meanMs=%d, wallMs=%d}"
                .formatted(total, succeeded, failed, records, meanProcessingTime.toMillis(), wallTime().toMillis());
    }
}
