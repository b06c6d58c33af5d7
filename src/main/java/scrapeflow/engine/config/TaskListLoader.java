package scrapeflow.engine.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scrapeflow.engine.error.ConfigurationException;
import scrapeflow.engine.model.Task;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the task list JSON. Accepts either a bare array or an object with a
 * {@code tasks} array:
 *
 * <pre>
 * {"tasks": [
 *   {"priority": 5, "url": "https://www.bbc.com/news", "type": "news"},
 *   {"priority": 1, "url": "", "type": "rss", "search_word": "inflation"}
 * ]}
 * </pre>
 *
 * Task ids are assigned in file order starting at 0.
 */
public final class TaskListLoader {

    private static final Logger log = LoggerFactory.getLogger(TaskListLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TaskEntry(
            @JsonProperty("priority") Integer priority,
            @JsonProperty("url") String url,
            @JsonProperty("type") String type,
            @JsonProperty("search_word") String searchWord) {
    }

    private TaskListLoader() {
    }

    public static List<Task> load(Path file) {
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read task list " + file + ": " + e.getMessage(), e);
        }
        List<Task> tasks = parse(json);
        log.info("Loaded {} tasks from {}", tasks.size(), file);
        return tasks;
    }

    /**
     * @throws ConfigurationException on malformed JSON or an entry without a type
     */
    public static List<Task> parse(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Task list is not valid JSON: " + e.getOriginalMessage(), e);
        }

        JsonNode array = root != null && root.isObject() ? root.get("tasks") : root;
        if (array == null || !array.isArray()) {
            throw new ConfigurationException("Task list must be an array or an object with a 'tasks' array");
        }

        List<Task> tasks = new ArrayList<>(array.size());
        int id = 0;
        for (JsonNode node : array) {
            TaskEntry entry;
            try {
                entry = MAPPER.treeToValue(node, TaskEntry.class);
            } catch (JsonProcessingException e) {
                throw new ConfigurationException("Task #" + id + " is malformed: " + e.getOriginalMessage(), e);
            }
            if (entry.type() == null || entry.type().isBlank()) {
                throw new ConfigurationException("Task #" + id + " has no type");
            }
            tasks.add(Task.builder()
                    .id(id)
                    .priority(entry.priority() != null ? entry.priority() : 0)
                    .url(entry.url())
                    .type(entry.type().trim())
                    .searchWord(entry.searchWord())
                    .build());
            id++;
        }
        return tasks;
    }
}
