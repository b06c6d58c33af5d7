package scrapeflow.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import scrapeflow.engine.model.RunRecord;

import java.time.Instant;

/**
 * One stored run.
 * GET /api/v1/runs
 */
public record RunSummaryResponse(
        @JsonProperty("id") String id,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt,
        @JsonProperty("total") int total,
        @JsonProperty("succeeded") int succeeded,
        @JsonProperty("failed") int failed,
        @JsonProperty("records") int records) {

    public static RunSummaryResponse from(RunRecord run) {
        return new RunSummaryResponse(run.id(), run.startedAt(), run.finishedAt(), run.total(), run.succeeded(),
                run.failed(), run.records());
    }
}
