package scrapeflow.engine.error;

/**
 * Invalid task list or worker bounds. Raised before any task runs.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
