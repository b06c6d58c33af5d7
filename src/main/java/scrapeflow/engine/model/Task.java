package scrapeflow.engine.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable unit of scraping work.
 * A higher {@code priority} is scheduled sooner; ties go to the lower id.
 */
public final class Task {
    private final int id;
    private final int priority;
    private final String url;
    private final String type;
    private final String searchWord;
    private final Instant createdAt;

    private Task(Builder builder) {
        this.id = builder.id;
        this.priority = builder.priority;
        this.url = builder.url == null ? "" : builder.url;
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.searchWord = builder.searchWord;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
    }

    public int id() {
        return id;
    }

    public int priority() {
        return priority;
    }

    /** Target address; empty for feed tasks that derive their own target. */
    public String url() {
        return url;
    }

    /** Declared kind, as written in the task list. */
    public String type() {
        return type;
    }

    public String searchWord() {
        return searchWord;
    }

    public Instant createdAt() {
        return createdAt;
    }

    /** The declared kind mapped to a known {@link SourceType}, if it is one. */
    public Optional<SourceType> sourceType() {
        return SourceType.fromId(type);
    }

    public boolean hasSearchWord() {
        return searchWord != null && !searchWord.isBlank();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .priority(priority)
                .url(url)
                .type(type)
                .searchWord(searchWord)
                .createdAt(createdAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int id;
        private int priority = 0;
        private String url = "";
        private String type;
        private String searchWord;
        private Instant createdAt;

        public Builder id(int id) {
            this.id = id;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder type(SourceType type) {
            this.type = type.id();
            return this;
        }

        public Builder searchWord(String searchWord) {
            this.searchWord = searchWord;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return id == task.id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        return "Task{id=" + id + ", priority=" + priority + ", type='" + type + "', url='" + url + "'}";
    }
}
