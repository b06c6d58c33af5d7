package scrapeflow.engine.error;

/**
 * Fewer workers than the configured minimum could be started.
 */
public class PoolExhaustionException extends RuntimeException {

    private final int started;
    private final int required;

    public PoolExhaustionException(int started, int required) {
        super("Started " + started + " of at least " + required + " required workers");
        this.started = started;
        this.required = required;
    }

    public int started() {
        return started;
    }

    public int required() {
        return required;
    }
}
