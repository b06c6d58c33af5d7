package scrapeflow.engine.config;

import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scrapeflow.engine.error.ConfigurationException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Loads engine settings from an INI file on top of an existing config.
 * Supports sections [workers], [rate], [retry], [fetch], [status], [output]
 * and [database]; every section and key is optional.
 *
 * <pre>
 * [workers]
 * min = 1
 * max = 3
 *
 * [rate]
 * requests_per_second = 1.0
 *
 * [retry]
 * max_attempts = 3
 * backoff_ms = 2000
 * </pre>
 */
public final class EngineIniLoader {

    private static final Logger log = LoggerFactory.getLogger(EngineIniLoader.class);

    private EngineIniLoader() {
    }

    /**
     * Load {@code file} over the defaults.
     */
    public static EngineConfig load(Path file) {
        return load(file, EngineConfig.defaults());
    }

    /**
     * Apply the settings found in {@code file} to {@code config}.
     *
     * @throws ConfigurationException if the file cannot be read or a value is malformed
     */
    public static EngineConfig load(Path file, EngineConfig config) {
        Ini ini = new Ini();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            ini.load(reader);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read config file " + file + ": " + e.getMessage(), e);
        }
        apply(ini, config);
        log.info("Loaded config from {}", file);
        return config;
    }

    static EngineConfig apply(Ini ini, EngineConfig config) {
        Profile.Section workers = ini.get("workers");
        if (workers != null) {
            int min = intValue(workers, "min", config.minWorkers());
            int max = intValue(workers, "max", config.maxWorkers());
            config.withWorkerBounds(min, max);
        }

        Profile.Section rate = ini.get("rate");
        if (rate != null) {
            config.withRequestsPerSecond(doubleValue(rate, "requests_per_second", config.requestsPerSecond()));
        }

        Profile.Section retry = ini.get("retry");
        if (retry != null) {
            config.withMaxAttempts(intValue(retry, "max_attempts", config.maxAttempts()));
            config.withRetryBackoff(millis(retry, "backoff_ms", config.retryBackoff()));
        }

        Profile.Section fetch = ini.get("fetch");
        if (fetch != null) {
            config.withFetchTimeout(millis(fetch, "timeout_ms", config.fetchTimeout()));
            String userAgent = opt(fetch, "user_agent");
            if (userAgent != null) {
                config.withUserAgent(userAgent);
            }
        }

        Profile.Section status = ini.get("status");
        if (status != null) {
            config.withStatusPort(intValue(status, "port", config.statusPort()));
            config.withProgressInterval(millis(status, "progress_ms", config.progressInterval()));
        }

        Profile.Section output = ini.get("output");
        if (output != null) {
            String dir = opt(output, "dir");
            if (dir != null) {
                config.withOutputDir(Path.of(dir));
            }
        }

        Profile.Section database = ini.get("database");
        if (database != null) {
            String url = opt(database, "url");
            if (url != null) {
                config.withDatabaseUrl(url);
            }
            config.withDatabasePoolSize(intValue(database, "pool_size", config.databasePoolSize()));
        }
        return config;
    }

    // ===== helpers =====
    private static String opt(Profile.Section section, String key) {
        String value = section.get(key);
        return (value == null || value.isBlank()) ? null : value.trim();
    }

    private static int intValue(Profile.Section section, String key, int def) {
        String value = opt(section, key);
        if (value == null) {
            return def;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                    "[" + section.getName() + "] " + key + " is not an integer: " + value, e);
        }
    }

    private static double doubleValue(Profile.Section section, String key, double def) {
        String value = opt(section, key);
        if (value == null) {
            return def;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                    "[" + section.getName() + "] " + key + " is not a number: " + value, e);
        }
    }

    private static Duration millis(Profile.Section section, String key, Duration def) {
        String value = opt(section, key);
        if (value == null) {
            return def;
        }
        try {
            return Duration.ofMillis(Long.parseLong(value));
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                    "[" + section.getName() + "] " + key + " is not a millisecond count: " + value, e);
        }
    }
}
