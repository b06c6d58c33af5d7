package scrapeflow.engine.model;

import java.util.List;

/**
 * Monitoring view of a master: worker statuses plus queue and progress counters.
 */
public record EngineSnapshot(
        List<WorkerStatus> workers,
        int queueDepth,
        int submitted,
        int completed,
        boolean running) {

    public EngineSnapshot {
        workers = List.copyOf(workers);
    }

    public long busyWorkers() {
        return workers.stream().filter(WorkerStatus::isBusy).count();
    }
}
