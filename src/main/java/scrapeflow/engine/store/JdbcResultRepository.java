package scrapeflow.engine.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scrapeflow.engine.model.Result;
import scrapeflow.engine.model.RunRecord;
import scrapeflow.engine.model.RunStats;
import scrapeflow.engine.repository.ResultRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of ResultRepository.
 * Scraped records and run statistics are stored as JSON.
 */
public class JdbcResultRepository implements ResultRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcResultRepository.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /** Width of the {@code error_message} column. */
    static final int MAX_ERROR_LENGTH = 2048;

    private static final TypeReference<List<Map<String, Object>>> RECORDS = new TypeReference<>() {
    };

    private final Database db;

    public JdbcResultRepository(Database db) {
        this.db = db;
    }

    @Override
    public String saveRun(RunStats stats, List<Result> results) {
        String runId = "run-" + UUID.randomUUID();
        String runSql = """
                    INSERT INTO runs (id, started_at, finished_at, total, succeeded, failed, record_count, stats)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;
        String resultSql = """
                    INSERT INTO results (run_id, task_id, worker_name, source_type, success, error_message,
                                         attempts, processing_ms, dispatch_sequence, dispatched_at, finished_at, payload)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(runSql)) {
                ps.setString(1, runId);
                setTimestamp(ps, 2, stats.startedAt());
                setTimestamp(ps, 3, stats.finishedAt());
                ps.setInt(4, stats.total());
                ps.setInt(5, stats.succeeded());
                ps.setInt(6, stats.failed());
                ps.setInt(7, stats.records());
                ps.setString(8, toJson(stats));
                ps.executeUpdate();
            }

            try (PreparedStatement ps = conn.prepareStatement(resultSql)) {
                for (Result result : results) {
                    ps.setString(1, runId);
                    ps.setInt(2, result.taskId());
                    ps.setString(3, result.workerName());
                    ps.setString(4, result.sourceType());
                    ps.setBoolean(5, result.success());
                    ps.setString(6, truncate(result.errorMessage(), MAX_ERROR_LENGTH));
                    ps.setInt(7, result.attempts());
                    ps.setLong(8, result.processingTime().toMillis());
                    ps.setLong(9, result.dispatchSequence());
                    setTimestamp(ps, 10, result.dispatchedAt());
                    setTimestamp(ps, 11, result.finishedAt());
                    ps.setString(12, toJson(result.data()));
                    ps.addBatch();
                }
                ps.executeBatch();
            }

            conn.commit();
            log.info("Saved run {} with {} results", runId, results.size());
            return runId;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save run: " + runId, e);
        }
    }

    @Override
    public Optional<RunRecord> findRun(String runId) {
        String sql = "SELECT * FROM runs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            ResultSet rs = ps.executeQuery();

            if (rs.next()) {
                return Optional.of(mapRun(rs));
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find run: " + runId, e);
        }
    }

    @Override
    public List<RunRecord> findRecentRuns(int limit) {
        String sql = "SELECT * FROM runs ORDER BY started_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            ResultSet rs = ps.executeQuery();

            List<RunRecord> runs = new ArrayList<>();
            while (rs.next()) {
                runs.add(mapRun(rs));
            }
            return runs;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find recent runs", e);
        }
    }

    @Override
    public List<Result> findResultsByRun(String runId) {
        String sql = "SELECT * FROM results WHERE run_id = ? ORDER BY id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            ResultSet rs = ps.executeQuery();

            List<Result> results = new ArrayList<>();
            while (rs.next()) {
                results.add(mapResult(rs));
            }
            return results;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find results for run: " + runId, e);
        }
    }

    // ==================== Helpers ====================

    private RunRecord mapRun(ResultSet rs) throws SQLException {
        return new RunRecord(
                rs.getString("id"),
                toInstant(rs.getTimestamp("started_at")),
                toInstant(rs.getTimestamp("finished_at")),
                rs.getInt("total"),
                rs.getInt("succeeded"),
                rs.getInt("failed"),
                rs.getInt("record_count"));
    }

    private Result mapResult(ResultSet rs) throws SQLException {
        boolean success = rs.getBoolean("success");
        return new Result(
                rs.getInt("task_id"),
                rs.getString("worker_name"),
                rs.getString("source_type"),
                fromJson(rs.getString("payload")),
                success,
                success ? null : rs.getString("error_message"),
                rs.getInt("attempts"),
                Duration.ofMillis(rs.getLong("processing_ms")),
                rs.getLong("dispatch_sequence"),
                toInstant(rs.getTimestamp("dispatched_at")),
                toInstant(rs.getTimestamp("finished_at")));
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static List<Map<String, Object>> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return MAPPER.readValue(json, RECORDS);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to parse stored records", e);
        }
    }
}
