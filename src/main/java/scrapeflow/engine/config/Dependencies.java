package scrapeflow.engine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scrapeflow.engine.api.v1.HealthController;
import scrapeflow.engine.api.v1.RunController;
import scrapeflow.engine.api.v1.StatusController;
import scrapeflow.engine.export.ResultExporter;
import scrapeflow.engine.repository.ResultRepository;
import scrapeflow.engine.scheduler.Master;
import scrapeflow.engine.scheduler.RateLimiter;
import scrapeflow.engine.scraper.DefaultScraperSelector;
import scrapeflow.engine.scraper.JsoupPageFetcher;
import scrapeflow.engine.scraper.ScraperSelector;
import scrapeflow.engine.server.RouterHandler;
import scrapeflow.engine.server.StatusServer;
import scrapeflow.engine.store.Database;
import scrapeflow.engine.store.JdbcResultRepository;

/**
 * Manual dependency injection container.
 * Creates and wires all engine dependencies.
 *
 * Usage:
 *
 * <pre>
 * try (Dependencies deps = Dependencies.create(config)) {
 *     deps.startStatusServer();
 *     deps.master().submit(tasks);
 *     RunStats stats = deps.master().run();
 * }
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final EngineConfig config;
    private final Database database;
    private final ResultRepository resultRepository;
    private final RateLimiter rateLimiter;
    private final ScraperSelector scraperSelector;
    private final Master master;
    private final ResultExporter exporter;

    // Controllers
    private final HealthController healthController;
    private final StatusController statusController;
    private final RunController runController;

    // Lazy-initialized
    private RouterHandler routerHandler;
    private StatusServer statusServer;

    private Dependencies(EngineConfig config, ScraperSelector selector) {
        this.config = config.validate();

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.resultRepository = new JdbcResultRepository(database);
        this.exporter = new ResultExporter(config.outputDir());

        // Engine
        this.rateLimiter = RateLimiter.perSecond(config.requestsPerSecond());
        this.scraperSelector = selector != null
                ? selector
                : new DefaultScraperSelector(new JsoupPageFetcher(config.userAgent(), config.fetchTimeout()));
        this.master = new Master(scraperSelector, rateLimiter, config);

        // Controllers
        this.healthController = new HealthController(database);
        this.statusController = new StatusController(master::snapshot);
        this.runController = new RunController(resultRepository);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config and the jsoup-backed scrapers.
     */
    public static Dependencies create(EngineConfig config) {
        return new Dependencies(config, null);
    }

    /**
     * Create dependencies with a custom scraper selector.
     */
    public static Dependencies create(EngineConfig config, ScraperSelector selector) {
        return new Dependencies(config, selector);
    }

    // Getters
    public EngineConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public ResultRepository resultRepository() {
        return resultRepository;
    }

    public RateLimiter rateLimiter() {
        return rateLimiter;
    }

    public ScraperSelector scraperSelector() {
        return scraperSelector;
    }

    public Master master() {
        return master;
    }

    public ResultExporter exporter() {
        return exporter;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(statusController)
                    .registerController(runController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Start the status server on the configured port.
     *
     * @return the running server
     */
    public synchronized StatusServer startStatusServer() {
        if (statusServer == null) {
            statusServer = new StatusServer(config.statusPort(), routerHandler());
        }
        statusServer.start();
        return statusServer;
    }

    @Override
    public synchronized void close() {
        log.info("Closing dependencies...");

        if (statusServer != null) {
            try {
                statusServer.stop();
            } catch (RuntimeException e) {
                log.warn("Error stopping status server: {}", e.getMessage());
            }
        }

        try {
            database.close();
        } catch (RuntimeException e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
