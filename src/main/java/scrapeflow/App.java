package scrapeflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scrapeflow.engine.config.Dependencies;
import scrapeflow.engine.config.EngineConfig;
import scrapeflow.engine.config.EngineIniLoader;
import scrapeflow.engine.config.TaskListLoader;
import scrapeflow.engine.error.ConfigurationException;
import scrapeflow.engine.error.PoolExhaustionException;
import scrapeflow.engine.model.Result;
import scrapeflow.engine.model.RunStats;
import scrapeflow.engine.model.Task;
import scrapeflow.engine.scheduler.Master;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Command-line entry point.
 *
 * <pre>
 * java -jar scrapeflow.jar tasks.json [scrapeflow.ini]
 * </pre>
 *
 * Exit codes: 0 when every task succeeded, 1 when some failed or the
 * results could not be stored, 2 on a setup error.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    static final int EXIT_OK = 0;
    static final int EXIT_TASKS_FAILED = 1;
    static final int EXIT_SETUP_ERROR = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.getenv()));
    }

    static int run(String[] args, Map<String, String> env) {
        if (args.length < 1 || args.length > 2) {
            log.error("Usage: scrapeflow <tasks.json> [config.ini]");
            return EXIT_SETUP_ERROR;
        }

        EngineConfig config;
        List<Task> tasks;
        try {
            config = args.length == 2 ? EngineIniLoader.load(Path.of(args[1])) : EngineConfig.defaults();
            config.applyEnv(env).validate();
            tasks = TaskListLoader.load(Path.of(args[0]));
        } catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            return EXIT_SETUP_ERROR;
        }

        Dependencies deps;
        try {
            deps = Dependencies.create(config);
        } catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            return EXIT_SETUP_ERROR;
        } catch (RuntimeException e) {
            log.error("Failed to initialize engine: {}", e.getMessage(), e);
            return EXIT_SETUP_ERROR;
        }

        try (deps) {
            if (config.statusServerEnabled()) {
                try {
                    deps.startStatusServer();
                } catch (IllegalStateException e) {
                    log.error("{}", e.getMessage(), e);
                    return EXIT_SETUP_ERROR;
                }
            }
            return execute(deps, tasks);
        } catch (ConfigurationException | PoolExhaustionException e) {
            log.error("Run aborted: {}", e.getMessage());
            return EXIT_SETUP_ERROR;
        }
    }

    static int execute(Dependencies deps, List<Task> tasks) {
        Master master = deps.master();
        master.submit(tasks);
        RunStats stats = master.run();
        List<Result> results = master.results();

        boolean stored = true;
        try {
            deps.exporter().export(stats, results);
            String runId = deps.resultRepository().saveRun(stats, results);
            log.info("Run stored as {}", runId);
        } catch (RuntimeException e) {
            log.error("Failed to store results: {}", e.getMessage(), e);
            stored = false;
        }

        logSummary(stats);
        return stats.failed() == 0 && stored ? EXIT_OK : EXIT_TASKS_FAILED;
    }

    private static void logSummary(RunStats stats) {
        log.info("==================== SUMMARY ====================");
        log.info("Tasks: {} total, {} succeeded, {} failed ({}% success)",
                stats.total(), stats.succeeded(), stats.failed(), String.format("%.1f", stats.successRate()));
        log.info("Records scraped: {}", stats.records());
        log.info("Processing time: mean {} ms, median {} ms, p95 {} ms, max {} ms",
                stats.meanProcessingTime().toMillis(), stats.medianProcessingTime().toMillis(),
                stats.p95ProcessingTime().toMillis(), stats.maxProcessingTime().toMillis());
        log.info("By source type: {}", stats.countsBySourceType());
        if (stats.failed() > 0) {
            log.info("Failures by source type: {}", stats.failuresBySourceType());
        }
        log.info("Wall time: {} ms", stats.wallTime().toMillis());
    }
}
