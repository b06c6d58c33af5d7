package scrapeflow.engine.model;

import java.time.Instant;

/**
 * Point-in-time view of one worker. Each worker replaces its own snapshot on
 * every state change; readers may see a slightly stale value.
 */
public record WorkerStatus(
        String workerName,
        WorkerState state,
        Integer currentTaskId,
        Instant busySince,
        int tasksCompleted,
        int tasksFailed,
        String lastError) {

    public static WorkerStatus idle(String workerName) {
        return new WorkerStatus(workerName, WorkerState.IDLE, null, null, 0, 0, null);
    }

    public WorkerStatus busy(int taskId) {
        return new WorkerStatus(workerName, WorkerState.BUSY, taskId, Instant.now(), tasksCompleted, tasksFailed,
                lastError);
    }

    public WorkerStatus finished(boolean success, String error) {
        return new WorkerStatus(workerName, WorkerState.IDLE, null, null,
                success ? tasksCompleted + 1 : tasksCompleted,
                success ? tasksFailed : tasksFailed + 1,
                success ? lastError : error);
    }

    /** Keeps the in-flight task id so the master can report it as orphaned. */
    public WorkerStatus dead(String error) {
        return new WorkerStatus(workerName, WorkerState.DEAD, currentTaskId, busySince, tasksCompleted, tasksFailed,
                error);
    }

    public WorkerStatus stopped() {
        return new WorkerStatus(workerName, WorkerState.STOPPED, null, null, tasksCompleted, tasksFailed, lastError);
    }

    public boolean isBusy() {
        return state == WorkerState.BUSY;
    }
}
