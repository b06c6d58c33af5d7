package scrapeflow.engine.model;

import java.time.Instant;

/**
 * Stored summary row of a finished run.
 */
public record RunRecord(
        String id,
        Instant startedAt,
        Instant finishedAt,
        int total,
        int succeeded,
        int failed,
        int records) {
}
