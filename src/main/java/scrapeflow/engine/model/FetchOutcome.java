package scrapeflow.engine.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a single fetch attempt. The retry loop consumes these values
 * instead of catching exceptions to decide whether to try again.
 */
public record FetchOutcome(boolean success, List<Map<String, Object>> data, String errorMessage) {

    public static FetchOutcome success(List<Map<String, Object>> data) {
        return new FetchOutcome(true, data == null ? List.of() : data, null);
    }

    public static FetchOutcome failure(String errorMessage) {
        return new FetchOutcome(false, List.of(), errorMessage);
    }
}
