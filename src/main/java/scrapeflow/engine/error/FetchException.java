package scrapeflow.engine.error;

/**
 * A single fetch attempt failed (network, timeout, unexpected page structure).
 */
public class FetchException extends Exception {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
