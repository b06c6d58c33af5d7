package scrapeflow.engine.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of executing exactly one task, produced by exactly one worker.
 * Never mutated after it is published to the master.
 *
 * @param taskId           id of the originating task
 * @param workerName       worker that executed the task
 * @param sourceType       kind id of the task, or its declared type when that is not a known kind
 * @param data             scraped records, in scraper order
 * @param success          whether the task succeeded
 * @param errorMessage     set iff {@code success} is false
 * @param attempts         fetch attempts made; 0 when the scraper could not be resolved
 * @param processingTime   elapsed time across resolution, limiter waits, backoff and attempts
 * @param dispatchSequence admission order of the task (1 for the first task taken from the queue)
 * @param dispatchedAt     when the worker took the task from the queue
 * @param finishedAt       when the result was produced
 */
public record Result(
        int taskId,
        String workerName,
        String sourceType,
        List<Map<String, Object>> data,
        boolean success,
        String errorMessage,
        int attempts,
        Duration processingTime,
        long dispatchSequence,
        Instant dispatchedAt,
        Instant finishedAt) {

    public Result {
        Objects.requireNonNull(workerName, "workerName is required");
        Objects.requireNonNull(processingTime, "processingTime is required");
        if (success && errorMessage != null) {
            throw new IllegalArgumentException("successful result cannot carry an error message");
        }
        if (!success && errorMessage == null) {
            errorMessage = "Unknown error";
        }
        data = freeze(data);
    }

    public static Result success(Task task, String workerName, List<Map<String, Object>> data, int attempts,
            Duration processingTime, long dispatchSequence, Instant dispatchedAt) {
        return new Result(task.id(), workerName, sourceTypeOf(task), data, true, null, attempts, processingTime,
                dispatchSequence, dispatchedAt, Instant.now());
    }

    public static Result failure(Task task, String workerName, String errorMessage, int attempts,
            Duration processingTime, long dispatchSequence, Instant dispatchedAt) {
        return new Result(task.id(), workerName, sourceTypeOf(task), List.of(), false, errorMessage, attempts,
                processingTime, dispatchSequence, dispatchedAt, Instant.now());
    }

    /** The canonical kind id, or the declared type as written when it is not a known kind. */
    private static String sourceTypeOf(Task task) {
        return task.sourceType().map(SourceType::id).orElse(task.type());
    }

    /** Number of scraped records. */
    public int recordCount() {
        return data.size();
    }

    private static List<Map<String, Object>> freeze(List<Map<String, Object>> data) {
        if (data == null || data.isEmpty()) {
            return List.of();
        }
        List<Map<String, Object>> copy = new ArrayList<>(data.size());
        for (Map<String, Object> item : data) {
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(item)));
        }
        return Collections.unmodifiableList(copy);
    }

    @Override
    public String toString() {
        return success
                ? "Result{task=%d, worker=%s, SUCCESS, %d records, %d attempts, %d ms}"
                        .formatted(taskId, workerName, data.size(), attempts, processingTime.toMillis())
                : "Result{task=%d, worker=%s, FAILED - %s, %d attempts}"
                        .formatted(taskId, workerName, errorMessage, attempts);
    }
}
