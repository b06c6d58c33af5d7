package scrapeflow.engine.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scrapeflow.engine.model.Result;
import scrapeflow.engine.model.RunStats;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Writes the outcome of a run to an output directory.
 *
 * Output files:
 * <ul>
 * <li>{@code <source_type>_data.json}: records of all successful results of that type</li>
 * <li>{@code combined.csv}: every scraped record of every type, one column per record key;
 * a later record with the same url replaces an earlier one</li>
 * <li>{@code summary.csv}: one row per result, in completion order</li>
 * <li>{@code run_stats.json}: the aggregate statistics</li>
 * </ul>
 */
public class ResultExporter {

    private static final Logger log = LoggerFactory.getLogger(ResultExporter.class);

    static final String COMBINED_FILE = "combined.csv";
    static final String SUMMARY_FILE = "summary.csv";
    static final String STATS_FILE = "run_stats.json";

    private static final String[] HEADERS = {
            "task_id", "worker", "source_type", "success",
            "attempts", "processing_ms", "records", "error"
    };

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);

    private static final ObjectWriter COMPACT = MAPPER.writer().without(SerializationFeature.INDENT_OUTPUT);

    private final Path outputDir;

    public ResultExporter(Path outputDir) {
        this.outputDir = outputDir;
    }

    /**
     * @return the files written
     * @throws UncheckedIOException if the directory or a file cannot be written
     */
    public List<Path> export(RunStats stats, List<Result> results) {
        ensureDirectory();
        List<Path> written = new ArrayList<>();

        Map<String, List<Map<String, Object>>> bySourceType = new TreeMap<>();
        for (Result result : results) {
            if (result.success()) {
                bySourceType.computeIfAbsent(result.sourceType(), k -> new ArrayList<>()).addAll(result.data());
            }
        }
        for (Map.Entry<String, List<Map<String, Object>>> entry : bySourceType.entrySet()) {
            Path file = outputDir.resolve(fileSafe(entry.getKey()) + "_data.json");
            writeJson(file, entry.getValue());
            log.info("Written {} {} records to {}", entry.getValue().size(), entry.getKey(), file);
            written.add(file);
        }

        Path combined = writeCombined(results);
        if (combined != null) {
            written.add(combined);
        }

        written.add(writeSummary(results));

        Path statsFile = outputDir.resolve(STATS_FILE);
        writeJson(statsFile, stats);
        written.add(statsFile);

        return written;
    }

    /**
     * @return the file, or null when no result carried records
     */
    private Path writeCombined(List<Result> results) {
        List<Map<String, Object>> records = new ArrayList<>();
        for (Result result : results) {
            if (!result.success()) {
                continue;
            }
            for (Map<String, Object> record : result.data()) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("source_type", result.sourceType());
                row.putAll(record);
                records.add(row);
            }
        }
        if (records.isEmpty()) {
            return null;
        }
        records = lastPerUrl(records);

        Set<String> columns = new LinkedHashSet<>();
        for (Map<String, Object> record : records) {
            columns.addAll(record.keySet());
        }

        Path file = outputDir.resolve(COMBINED_FILE);
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVWriter writer = new CSVWriter(out)) {

            writer.writeNext(columns.toArray(new String[0]));
            for (Map<String, Object> record : records) {
                String[] row = new String[columns.size()];
                int i = 0;
                for (String column : columns) {
                    row[i++] = cell(record.get(column));
                }
                writer.writeNext(row);
            }
            log.info("Written {} combined records to {}", records.size(), file);
            return file;
        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", file, e.getMessage(), e);
            throw new UncheckedIOException("CSV write failed: " + file, e);
        }
    }

    private static List<Map<String, Object>> lastPerUrl(List<Map<String, Object>> records) {
        Set<Object> seen = new HashSet<>();
        List<Map<String, Object>> kept = new ArrayList<>();
        for (int i = records.size() - 1; i >= 0; i--) {
            Map<String, Object> record = records.get(i);
            Object url = record.get("url");
            if (url == null || url.toString().isEmpty() || seen.add(url)) {
                kept.add(record);
            }
        }
        Collections.reverse(kept);
        return kept;
    }

    /** Scalars as text, nested values as compact JSON. */
    private static String cell(Object value) throws JsonProcessingException {
        if (value == null) {
            return "";
        }
        if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        return COMPACT.writeValueAsString(value);
    }

    private Path writeSummary(List<Result> results) {
        Path file = outputDir.resolve(SUMMARY_FILE);
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVWriter writer = new CSVWriter(
                        out,
                        CSVWriter.DEFAULT_SEPARATOR,
                        CSVWriter.DEFAULT_QUOTE_CHARACTER,
                        CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                        CSVWriter.DEFAULT_LINE_END)) {

            writer.writeNext(HEADERS);
            for (Result result : results) {
                writer.writeNext(toRow(result));
            }
            log.info("Written {} result rows to {}", results.size(), file);
            return file;
        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", file, e.getMessage(), e);
            throw new UncheckedIOException("CSV write failed: " + file, e);
        }
    }

    private static String[] toRow(Result r) {
        return new String[] {
                String.valueOf(r.taskId()),
                r.workerName(),
                r.sourceType(),
                String.valueOf(r.success()),
                String.valueOf(r.attempts()),
                String.valueOf(r.processingTime().toMillis()),
                String.valueOf(r.recordCount()),
                r.errorMessage() != null ? r.errorMessage() : ""
        };
    }

    private void writeJson(Path file, Object value) {
        try {
            MAPPER.writeValue(file.toFile(), value);
        } catch (IOException e) {
            log.error("Failed to write JSON file {}: {}", file, e.getMessage(), e);
            throw new UncheckedIOException("JSON write failed: " + file, e);
        }
    }

    private void ensureDirectory() {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory: " + outputDir, e);
        }
    }

    private static String fileSafe(String name) {
        return name.replaceAll("[^A-Za-z0-9_-]", "_");
    }
}
