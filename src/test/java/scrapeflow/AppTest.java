package scrapeflow;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import scrapeflow.engine.config.Dependencies;
import scrapeflow.engine.config.EngineConfig;
import scrapeflow.engine.model.SourceType;
import scrapeflow.engine.model.Task;
import scrapeflow.engine.scraper.ScriptedScraper;
import scrapeflow.engine.scraper.StubScraperSelector;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AppTest {

    @TempDir
    Path dir;

    private Map<String, String> env() {
        return Map.of(
                "SCRAPEFLOW_DB_URL", "jdbc:h2:mem:test-app-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE",
                "SCRAPEFLOW_OUTPUT_DIR", dir.resolve("out").toString());
    }

    private EngineConfig config() {
        return EngineConfig.defaults()
                .applyEnv(env())
                .withRequestsPerSecond(1000)
                .withMaxAttempts(1)
                .withLivenessInterval(Duration.ofMillis(50));
    }

    private static List<Task> tasks() {
        return List.of(
                Task.builder().id(0).priority(2).type(SourceType.NEWS).url("https://example.org/n").build(),
                Task.builder().id(1).priority(1).type(SourceType.BLOG).url("https://example.org/b").build());
    }

    @Test
    void wrongArgumentCountIsASetupError() {
        assertEquals(App.EXIT_SETUP_ERROR, App.run(new String[0], env()));
        assertEquals(App.EXIT_SETUP_ERROR, App.run(new String[] { "a", "b", "c" }, env()));
    }

    @Test
    void missingTaskFileIsASetupError() {
        assertEquals(App.EXIT_SETUP_ERROR, App.run(new String[] { dir.resolve("absent.json").toString() }, env()));
    }

    @Test
    void invalidEnvironmentIsASetupError() throws Exception {
        Path tasks = dir.resolve("tasks.json");
        Files.writeString(tasks, "[{\"type\": \"news\", \"url\": \"https://example.org\"}]");

        assertEquals(App.EXIT_SETUP_ERROR,
                App.run(new String[] { tasks.toString() }, Map.of("SCRAPEFLOW_MAX_WORKERS", "0")));
    }

    @Test
    void unsupportedTaskTypeIsASetupError() throws Exception {
        Path tasks = dir.resolve("tasks.json");
        Files.writeString(tasks, "[{\"type\": \"podcast\", \"url\": \"https://example.org\"}]");

        assertEquals(App.EXIT_SETUP_ERROR, App.run(new String[] { tasks.toString() }, env()));
    }

    @Test
    void unusableDatabaseIsASetupError() throws Exception {
        Path tasks = dir.resolve("tasks.json");
        Files.writeString(tasks, "[{\"type\": \"news\", \"url\": \"https://example.org\"}]");
        Map<String, String> env = Map.of(
                "SCRAPEFLOW_DB_URL", "jdbc:unknown:nowhere",
                "SCRAPEFLOW_OUTPUT_DIR", dir.resolve("out").toString());

        assertEquals(App.EXIT_SETUP_ERROR, App.run(new String[] { tasks.toString() }, env));
        assertFalse(Files.exists(dir.resolve("out")));
    }

    @Test
    void allTasksSucceedingExitsZero() {
        try (Dependencies deps = Dependencies.create(config(), StubScraperSelector.all(ScriptedScraper.succeeding()))) {
            assertEquals(App.EXIT_OK, App.execute(deps, tasks()));
            assertTrue(Files.exists(dir.resolve("out").resolve("summary.csv")));
            assertEquals(1, deps.resultRepository().findRecentRuns(10).size());
        }
    }

    @Test
    void anyFailedTaskExitsOne() {
        StubScraperSelector selector = StubScraperSelector.of(SourceType.NEWS, ScriptedScraper.succeeding());

        try (Dependencies deps = Dependencies.create(config(), selector)) {
            assertEquals(App.EXIT_TASKS_FAILED, App.execute(deps, tasks()));
        }
    }
}
