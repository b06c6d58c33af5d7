package scrapeflow.engine.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of scraper kinds a task can declare.
 */
public enum SourceType {
    /** News front pages */
    NEWS("news"),
    /** RSS feeds, optionally filtered by a search word */
    RSS("rss"),
    /** Blog listing pages */
    BLOG("blog");

    private final String id;

    SourceType(String id) {
        this.id = id;
    }

    /** Identifier used in task lists and results. */
    public String id() {
        return id;
    }

    /**
     * Map a declared task type to a kind.
     *
     * @param id declared type, case-insensitive
     * @return the kind, or empty if the type is not one of the known kinds
     */
    public static Optional<SourceType> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (SourceType type : values()) {
            if (type.id.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public static List<String> ids() {
        return Arrays.stream(values()).map(SourceType::id).toList();
    }
}
