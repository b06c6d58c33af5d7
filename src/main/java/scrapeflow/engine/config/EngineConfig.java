package scrapeflow.engine.config;

import scrapeflow.engine.error.ConfigurationException;
import scrapeflow.engine.scheduler.RateLimiter;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Configuration holder for engine settings.
 * All settings have sensible defaults.
 */
public final class EngineConfig {

    // Pool settings
    private int minWorkers = 1;
    private int maxWorkers = 3;

    // Throttling and retry
    private double requestsPerSecond = 1.0;
    private int maxAttempts = 3;
    private Duration retryBackoff = Duration.ofSeconds(2);

    // Master loop
    private Duration livenessInterval = Duration.ofMillis(250);
    private Duration shutdownTimeout = Duration.ofSeconds(5);
    // Period of the progress log line, zero disables it
    private Duration progressInterval = Duration.ofSeconds(4);

    // Fetching
    private String userAgent = "Mozilla/5.0 (compatible; scrapeflow/1.0)";
    private Duration fetchTimeout = Duration.ofSeconds(10);

    // Status server, 0 disables it
    private int statusPort = 0;

    // Output
    private Path outputDir = Path.of("data_output");
    private String databaseUrl = "jdbc:h2:file:./data/scrapeflow;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 4;

    private EngineConfig() {
    }

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    public static EngineConfig fromEnv() {
        return defaults().applyEnv(System.getenv());
    }

    /**
     * Override settings from SCRAPEFLOW_* variables present in {@code env}.
     */
    public EngineConfig applyEnv(Map<String, String> env) {
        String minWorkers = env.get("SCRAPEFLOW_MIN_WORKERS");
        if (minWorkers != null && !minWorkers.isBlank()) {
            this.minWorkers = parseInt("SCRAPEFLOW_MIN_WORKERS", minWorkers);
        }

        String maxWorkers = env.get("SCRAPEFLOW_MAX_WORKERS");
        if (maxWorkers != null && !maxWorkers.isBlank()) {
            this.maxWorkers = parseInt("SCRAPEFLOW_MAX_WORKERS", maxWorkers);
        }

        String rate = env.get("SCRAPEFLOW_RATE");
        if (rate != null && !rate.isBlank()) {
            try {
                this.requestsPerSecond = Double.parseDouble(rate.trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException("SCRAPEFLOW_RATE is not a number: " + rate, e);
            }
        }

        String port = env.get("SCRAPEFLOW_STATUS_PORT");
        if (port != null && !port.isBlank()) {
            this.statusPort = parseInt("SCRAPEFLOW_STATUS_PORT", port);
        }

        String dbUrl = env.get("SCRAPEFLOW_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            this.databaseUrl = dbUrl.trim();
        }

        String outputDir = env.get("SCRAPEFLOW_OUTPUT_DIR");
        if (outputDir != null && !outputDir.isBlank()) {
            this.outputDir = Path.of(outputDir.trim());
        }

        return this;
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(name + " is not an integer: " + value, e);
        }
    }

    /**
     * @throws ConfigurationException if any setting is out of range
     */
    public EngineConfig validate() {
        if (minWorkers < 1 || minWorkers > maxWorkers) {
            throw new ConfigurationException(
                    "Worker bounds must satisfy 1 <= min <= max, got min=" + minWorkers + ", max=" + maxWorkers);
        }
        if (!(requestsPerSecond > 0) || Double.isInfinite(requestsPerSecond)) {
            throw new ConfigurationException("requests_per_second must be positive, got " + requestsPerSecond);
        }
        if (requestsPerSecond < RateLimiter.MIN_REQUESTS_PER_SECOND) {
            throw new ConfigurationException("requests_per_second must be at least "
                    + RateLimiter.MIN_REQUESTS_PER_SECOND + ", got " + requestsPerSecond);
        }
        if (maxAttempts < 1) {
            throw new ConfigurationException("max_attempts must be at least 1, got " + maxAttempts);
        }
        if (retryBackoff.isNegative()) {
            throw new ConfigurationException("backoff must not be negative, got " + retryBackoff);
        }
        if (livenessInterval.isZero() || livenessInterval.isNegative()) {
            throw new ConfigurationException("liveness interval must be positive, got " + livenessInterval);
        }
        if (progressInterval.isNegative()) {
            throw new ConfigurationException("progress interval must not be negative, got " + progressInterval);
        }
        if (statusPort < 0 || statusPort > 65535) {
            throw new ConfigurationException("status port out of range: " + statusPort);
        }
        if (databasePoolSize < 1) {
            throw new ConfigurationException("database pool size must be at least 1, got " + databasePoolSize);
        }
        return this;
    }

    // Getters
    public int minWorkers() {
        return minWorkers;
    }

    public int maxWorkers() {
        return maxWorkers;
    }

    public double requestsPerSecond() {
        return requestsPerSecond;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration retryBackoff() {
        return retryBackoff;
    }

    public Duration livenessInterval() {
        return livenessInterval;
    }

    public Duration shutdownTimeout() {
        return shutdownTimeout;
    }

    public Duration progressInterval() {
        return progressInterval;
    }

    public String userAgent() {
        return userAgent;
    }

    public Duration fetchTimeout() {
        return fetchTimeout;
    }

    public int statusPort() {
        return statusPort;
    }

    public boolean statusServerEnabled() {
        return statusPort > 0;
    }

    public Path outputDir() {
        return outputDir;
    }

    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    // Fluent setters for testing/customization
    public EngineConfig withWorkerBounds(int min, int max) {
        this.minWorkers = min;
        this.maxWorkers = max;
        return this;
    }

    public EngineConfig withRequestsPerSecond(double rate) {
        this.requestsPerSecond = rate;
        return this;
    }

    public EngineConfig withMaxAttempts(int attempts) {
        this.maxAttempts = attempts;
        return this;
    }

    public EngineConfig withRetryBackoff(Duration backoff) {
        this.retryBackoff = backoff;
        return this;
    }

    public EngineConfig withLivenessInterval(Duration interval) {
        this.livenessInterval = interval;
        return this;
    }

    public EngineConfig withShutdownTimeout(Duration timeout) {
        this.shutdownTimeout = timeout;
        return this;
    }

    public EngineConfig withProgressInterval(Duration interval) {
        this.progressInterval = interval;
        return this;
    }

    public EngineConfig withUserAgent(String userAgent) {
        this.userAgent = userAgent;
        return this;
    }

    public EngineConfig withFetchTimeout(Duration timeout) {
        this.fetchTimeout = timeout;
        return this;
    }

    public EngineConfig withStatusPort(int port) {
        this.statusPort = port;
        return this;
    }

    public EngineConfig withOutputDir(Path dir) {
        this.outputDir = dir;
        return this;
    }

    public EngineConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public EngineConfig withDatabasePoolSize(int size) {
        this.databasePoolSize = size;
        return this;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "workers=" + minWorkers + ".." + maxWorkers +
                ", requestsPerSecond=" + requestsPerSecond +
                ", maxAttempts=" + maxAttempts +
                ", retryBackoff=" + retryBackoff +
                ", statusPort=" + statusPort +
                ", outputDir=" + outputDir +
                ", databaseUrl='" + databaseUrl + '\'' +
                '}';
    }
}
