package scrapeflow.engine.error;

/**
 * No scraper can be provided for a task type. Never retried.
 */
public class ResolutionException extends Exception {

    public ResolutionException(String message) {
        super(message);
    }

    public ResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
