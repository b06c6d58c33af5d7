package scrapeflow.engine.scheduler;

import scrapeflow.engine.model.Result;
import scrapeflow.engine.model.RunStats;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds {@link RunStats} incrementally as results arrive.
 * Not thread-safe: owned by the thread collecting results.
 */
public final class RunStatsCollector {

    private final Instant startedAt;
    private final List<Duration> processingTimes = new ArrayList<>();
    private final Map<String, Integer> countsBySourceType = new TreeMap<>();
    private final Map<String, Integer> failuresBySourceType = new TreeMap<>();

    private int succeeded;
    private int failed;
    private int records;
    private Duration totalProcessingTime = Duration.ZERO;
    private Instant lastResultAt;

    public RunStatsCollector(Instant startedAt) {
        this.startedAt = startedAt;
        this.lastResultAt = startedAt;
    }

    public void add(Result result) {
        if (result.success()) {
            succeeded++;
            records += result.recordCount();
        } else {
            failed++;
            failuresBySourceType.merge(result.sourceType(), 1, Integer::sum);
        }
        countsBySourceType.merge(result.sourceType(), 1, Integer::sum);
        processingTimes.add(result.processingTime());
        totalProcessingTime = totalProcessingTime.plus(result.processingTime());
        if (result.finishedAt() != null && result.finishedAt().isAfter(lastResultAt)) {
            lastResultAt = result.finishedAt();
        }
    }

    public int count() {
        return succeeded + failed;
    }

    public int succeeded() {
        return succeeded;
    }

    public int failed() {
        return failed;
    }

    public RunStats snapshot() {
        int total = count();
        if (total == 0) {
            return RunStats.empty(startedAt);
        }
        List<Duration> sorted = new ArrayList<>(processingTimes);
        Collections.sort(sorted);
        return new RunStats(
                total,
                succeeded,
                failed,
                records,
                sorted.get(0),
                totalProcessingTime.dividedBy(total),
                percentile(sorted, 50),
                percentile(sorted, 95),
                sorted.get(sorted.size() - 1),
                countsBySourceType,
                failuresBySourceType,
                startedAt,
                lastResultAt);
    }

    /** Nearest-rank percentile over an ascending list. */
    static Duration percentile(List<Duration> sorted, int percent) {
        int rank = (int) Math.ceil(percent / 100.0 * sorted.size());
        return sorted.get(Math.max(0, rank - 1));
    }
}
