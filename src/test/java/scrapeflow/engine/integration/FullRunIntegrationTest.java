package scrapeflow.engine.integration;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import scrapeflow.engine.config.Dependencies;
import scrapeflow.engine.config.EngineConfig;
import scrapeflow.engine.config.TaskListLoader;
import scrapeflow.engine.model.Result;
import scrapeflow.engine.model.RunRecord;
import scrapeflow.engine.model.RunStats;
import scrapeflow.engine.model.SourceType;
import scrapeflow.engine.model.Task;
import scrapeflow.engine.scraper.ScriptedScraper;
import scrapeflow.engine.scraper.StubScraperSelector;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Task list in, exported files and stored run out, with scripted scrapers
 * standing in for the network.
 */
class FullRunIntegrationTest {

    @TempDir
    Path outputDir;

    private Dependencies deps;
    private ScriptedScraper news;
    private ScriptedScraper rss;

    @BeforeEach
    void setUp() {
        EngineConfig config = EngineConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-flow-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withOutputDir(outputDir)
                .withWorkerBounds(1, 3)
                .withRequestsPerSecond(1000)
                .withMaxAttempts(2)
                .withRetryBackoff(Duration.ZERO)
                .withLivenessInterval(Duration.ofMillis(50));

        news = ScriptedScraper.succeeding();
        rss = ScriptedScraper.alwaysFailing();
        deps = Dependencies.create(config, StubScraperSelector.of(SourceType.NEWS, news).with(SourceType.RSS, rss));
    }

    @AfterEach
    void tearDown() {
        deps.close();
    }

    @Test
    @DisplayName("Full flow: load, run, export, store, read back")
    void fullFlow() throws Exception {
        List<Task> tasks = TaskListLoader.parse("""
                {"tasks": [
                  {"priority": 5, "url": "https://www.bbc.com/news", "type": "news"},
                  {"priority": 3, "url": "https://example.org/world", "type": "news"},
                  {"priority": 1, "url": "", "type": "rss", "search_word": "climate"},
                  {"priority": 4, "url": "https://example.org/blog", "type": "blog"}
                ]}
                """);

        deps.master().submit(tasks);
        RunStats stats = deps.master().run();
        List<Result> results = deps.master().results();

        // 1. Every task accounted for
        assertEquals(4, stats.total());
        assertEquals(2, stats.succeeded());
        assertEquals(2, stats.failed());
        assertEquals(4, results.size());

        Map<Integer, Result> byId = results.stream().collect(Collectors.toMap(Result::taskId, r -> r));
        assertTrue(byId.get(0).success());
        assertTrue(byId.get(1).success());
        assertEquals(2, byId.get(2).attempts());
        assertEquals(0, byId.get(3).attempts());
        assertEquals(2, news.calls());
        assertEquals(2, rss.calls());

        // 2. Export
        List<Path> written = deps.exporter().export(stats, results);
        assertTrue(written.contains(outputDir.resolve("news_data.json")));
        assertTrue(Files.exists(outputDir.resolve("summary.csv")));
        assertTrue(Files.exists(outputDir.resolve("run_stats.json")));
        assertFalse(Files.exists(outputDir.resolve("rss_data.json")));

        // 3. Store and read back
        String runId = deps.resultRepository().saveRun(stats, results);
        RunRecord run = deps.resultRepository().findRun(runId).orElseThrow();
        assertEquals(4, run.total());
        assertEquals(2, run.succeeded());

        List<Result> stored = deps.resultRepository().findResultsByRun(runId);
        assertEquals(results.stream().map(Result::taskId).collect(Collectors.toList()),
                stored.stream().map(Result::taskId).collect(Collectors.toList()));
    }

    @Test
    void masterCanRunAgainAfterARun() {
        deps.master().submit(List.of(Task.builder().id(0).type(SourceType.NEWS).url("https://example.org/1").build()));
        assertEquals(1, deps.master().run().succeeded());

        deps.master().submit(List.of(Task.builder().id(0).type(SourceType.NEWS).url("https://example.org/2").build()));
        RunStats second = deps.master().run();

        assertEquals(1, second.total());
        assertEquals(1, deps.master().results().size());
        assertEquals(1, deps.master().snapshot().submitted());
    }
}
