package scrapeflow.engine.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scrapeflow.engine.config.EngineConfig;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling; connections are handed out with
 * auto-commit disabled.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(EngineConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("scrapeflow-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);
        log.info("Database pool initialized: {}", jdbcUrl);

        try {
            initSchema();
        } catch (RuntimeException e) {
            dataSource.close();
            throw e;
        }
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- RUNS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS runs (
                            id              VARCHAR(64) PRIMARY KEY,
                            started_at      TIMESTAMP,
                            finished_at     TIMESTAMP,
                            total           INT DEFAULT 0,
                            succeeded       INT DEFAULT 0,
                            failed          INT DEFAULT 0,
                            record_count    INT DEFAULT 0,
                            stats           CLOB
                        );
                    """);

            // ---------- RESULTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS results (
                            id                  BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            run_id              VARCHAR(64) NOT NULL,
                            task_id             INT NOT NULL,
                            worker_name         VARCHAR(64) NOT NULL,
                            source_type         VARCHAR(32),
                            success             BOOLEAN NOT NULL,
                            error_message       VARCHAR(2048),
                            attempts            INT DEFAULT 0,
                            processing_ms       BIGINT,
                            dispatch_sequence   BIGINT,
                            dispatched_at       TIMESTAMP,
                            finished_at         TIMESTAMP,
                            payload             CLOB
                        );
                    """);

            st.addBatch("CREATE INDEX IF NOT EXISTS idx_results_run ON results(run_id, id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_runs_started ON runs(started_at);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
