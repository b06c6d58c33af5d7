package scrapeflow.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import scrapeflow.engine.model.EngineSnapshot;
import scrapeflow.engine.model.WorkerStatus;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Response DTO for the engine status.
 * GET /api/v1/status
 */
public record StatusResponse(
        @JsonProperty("running") boolean running,
        @JsonProperty("submitted") int submitted,
        @JsonProperty("completed") int completed,
        @JsonProperty("queueDepth") int queueDepth,
        @JsonProperty("busyWorkers") long busyWorkers,
        @JsonProperty("workers") List<WorkerInfo> workers) {

    /**
     * One worker of the pool.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record WorkerInfo(
            @JsonProperty("name") String name,
            @JsonProperty("state") String state,
            @JsonProperty("currentTaskId") Integer currentTaskId,
            @JsonProperty("busySince") Instant busySince,
            @JsonProperty("tasksCompleted") int tasksCompleted,
            @JsonProperty("tasksFailed") int tasksFailed,
            @JsonProperty("lastError") String lastError) {

        public static WorkerInfo from(WorkerStatus status) {
            return new WorkerInfo(
                    status.workerName(),
                    status.state().name(),
                    status.currentTaskId(),
                    status.busySince(),
                    status.tasksCompleted(),
                    status.tasksFailed(),
                    status.lastError());
        }
    }

    public static StatusResponse from(EngineSnapshot snapshot) {
        return new StatusResponse(
                snapshot.running(),
                snapshot.submitted(),
                snapshot.completed(),
                snapshot.queueDepth(),
                snapshot.busyWorkers(),
                snapshot.workers().stream().map(WorkerInfo::from).collect(Collectors.toList()));
    }
}
