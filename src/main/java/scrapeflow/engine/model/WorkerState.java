package scrapeflow.engine.model;

/**
 * Worker lifecycle state.
 */
public enum WorkerState {
    /** Started, waiting for a task */
    IDLE,
    /** Executing a task */
    BUSY,
    /** Terminated abnormally */
    DEAD,
    /** Exited after the queue was closed */
    STOPPED
}
