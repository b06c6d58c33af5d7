package scrapeflow.engine.repository;

import scrapeflow.engine.model.Result;
import scrapeflow.engine.model.RunRecord;
import scrapeflow.engine.model.RunStats;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for finished runs and their results.
 */
public interface ResultRepository {

    /**
     * Store a finished run and every one of its results in one transaction.
     *
     * @param stats   aggregate of the run
     * @param results results in completion order
     * @return the generated run id
     */
    String saveRun(RunStats stats, List<Result> results);

    /**
     * Find a run by ID.
     *
     * @param runId the run ID
     * @return the run summary if found
     */
    Optional<RunRecord> findRun(String runId);

    /**
     * Get recent runs, newest first.
     *
     * @param limit maximum results
     * @return list of run summaries
     */
    List<RunRecord> findRecentRuns(int limit);

    /**
     * Get the results of a run in the order they were collected.
     *
     * @param runId the run ID
     * @return list of results, empty for an unknown run
     */
    List<Result> findResultsByRun(String runId);
}
