package com.propertyintel.ingest.service;

import com.propertyintel.ingest.model.EtlRun;
import com.propertyintel.ingest.model.EtlStats;
import com.propertyintel.ingest.model.RunComparison;
import com.propertyintel.ingest.model.RunComparison.Anomaly;
import com.propertyintel.ingest.model.RunComparison.Delta;
import com.propertyintel.ingest.model.RunComparison.RunSnapshot;
import com.propertyintel.ingest.model.RunComparison.Severity;
import com.propertyintel.ingest.model.RunStatus;
import com.propertyintel.ingest.model.SourceType;
import com.propertyintel.ingest.output.JsonColumns;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Bookkeeping for ingestion runs in etl_runs: start, one completion, queries,
 * period statistics and run-to-run comparison.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RunTracker {

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final Clock clock;

    public EtlRun startRun(SourceType sourceType, Map<String, Object> metadata) {
        EtlRun run = EtlRun.builder()
                .runId(UUID.randomUUID().toString())
                .sourceType(sourceType)
                .status(RunStatus.RUNNING)
                .startedAt(LocalDateTime.now(clock))
                .metadata(metadata != null ? metadata : Map.of())
                .build();

        jdbcTemplate.update("""
                INSERT INTO etl_runs (run_id, source_type, status, started_at, run_metadata)
                VALUES (?, ?, ?, ?, ?)
                """,
                run.getRunId(), sourceType.value(), RunStatus.RUNNING.value(),
                Timestamp.valueOf(run.getStartedAt()), json.write(run.getMetadata()));

        log.info("ETL run started: {} [{}]", run.getRunId(), sourceType.value());
        return run;
    }

    /**
     * Final write of a run. Copies status, counters, error and checkpoint snapshot
     * onto {@code run} and persists them.
     *
     * @throws IllegalStateException if the run is unknown or already completed
     */
    public EtlRun completeRun(EtlRun run,
                              RunStatus status,
                              RunCounts counts,
                              Throwable error,
                              Map<String, Object> checkpointData) {
        LocalDateTime completedAt = LocalDateTime.now(clock);
        double duration = Duration.between(run.getStartedAt(), completedAt).toNanos() / 1_000_000_000.0;

        run.setStatus(status);
        run.setCompletedAt(completedAt);
        run.setDurationSeconds(duration);
        run.setRecordsExtracted(counts.extracted());
        run.setRecordsTransformed(counts.transformed());
        run.setRecordsLoaded(counts.loaded());
        run.setRecordsSkipped(counts.skipped());
        run.setRecordsFailed(counts.failed());
        if (error != null) {
            run.setErrorMessage(String.valueOf(error.getMessage()));
            run.setErrorTrace(stackTrace(error));
        }
        if (checkpointData != null && !checkpointData.isEmpty()) {
            run.setCheckpointData(checkpointData);
        }

        int updated = jdbcTemplate.update("""
                UPDATE etl_runs
                   SET status = ?, completed_at = ?, duration_seconds = ?,
                       records_extracted = ?, records_transformed = ?, records_loaded = ?,
                       records_skipped = ?, records_failed = ?,
                       error_message = ?, error_trace = ?, checkpoint_data = ?
                 WHERE run_id = ? AND status = ?
                """,
                status.value(), Timestamp.valueOf(completedAt), duration,
                counts.extracted(), counts.transformed(), counts.loaded(),
                counts.skipped(), counts.failed(),
                run.getErrorMessage(), run.getErrorTrace(), json.write(run.getCheckpointData()),
                run.getRunId(), RunStatus.RUNNING.value());

        if (updated == 0) {
            throw new IllegalStateException("Run " + run.getRunId() + " is unknown or already completed");
        }

        log.info("ETL run completed: {} [{}] status={} duration={}s loaded={}",
                run.getRunId(), run.getSourceType().value(), status.value(),
                String.format("%.2f", duration), counts.loaded());
        return run;
    }

    public Optional<EtlRun> findRun(String runId) {
        return jdbcTemplate.query("SELECT * FROM etl_runs WHERE run_id = ?", this::mapRow, runId)
                .stream().findFirst();
    }

    /** Most recent by start time. Either filter may be null. */
    public Optional<EtlRun> findLatestRun(SourceType sourceType, RunStatus status) {
        return listRuns(sourceType, status, 1, 0).stream().findFirst();
    }

    public List<EtlRun> listRuns(SourceType sourceType, RunStatus status, int limit, int offset) {
        StringBuilder sql = new StringBuilder("SELECT * FROM etl_runs WHERE 1 = 1");
        List<Object> args = new ArrayList<>();
        if (sourceType != null) {
            sql.append(" AND source_type = ?");
            args.add(sourceType.value());
        }
        if (status != null) {
            sql.append(" AND status = ?");
            args.add(status.value());
        }
        sql.append(" ORDER BY started_at DESC, id DESC LIMIT ? OFFSET ?");
        args.add(limit);
        args.add(offset);
        return jdbcTemplate.query(sql.toString(), this::mapRow, args.toArray());
    }

    /**
     * Aggregates over the last {@code hours}. The average duration covers every
     * completed run in the period; last success/failure look at all history.
     */
    public EtlStats stats(int hours) {
        Timestamp cutoff = Timestamp.valueOf(LocalDateTime.now(clock).minusHours(hours));

        Map<String, Long> bySource = new LinkedHashMap<>();
        jdbcTemplate.query(
                "SELECT source_type, COUNT(*) AS cnt FROM unified_records GROUP BY source_type ORDER BY source_type",
                rs -> {
                    bySource.put(rs.getString("source_type"), rs.getLong("cnt"));
                });
        long total = bySource.values().stream().mapToLong(Long::longValue).sum();

        List<EtlRun> runs = jdbcTemplate.query(
                "SELECT * FROM etl_runs WHERE started_at >= ?", this::mapRow, cutoff);
        long successful = runs.stream().filter(r -> r.getStatus() == RunStatus.SUCCESS).count();
        double avgDuration = runs.stream()
                .filter(r -> r.getDurationSeconds() != null)
                .mapToDouble(EtlRun::getDurationSeconds)
                .average()
                .orElse(0.0);

        LocalDateTime lastSuccess = findLatestRun(null, RunStatus.SUCCESS).map(EtlRun::getCompletedAt).orElse(null);
        LocalDateTime lastFailure = findLatestRun(null, RunStatus.FAILED).map(EtlRun::getCompletedAt).orElse(null);

        return new EtlStats(
                total,
                bySource,
                runs.size(),
                runs.isEmpty() ? 0.0 : (double) successful / runs.size(),
                avgDuration,
                lastSuccess,
                lastFailure,
                hours);
    }

    /**
     * Differences are reported from {@code runId1} to {@code runId2}.
     * Record and duration deltas are only computed when both sides are non-zero.
     *
     * @throws IllegalArgumentException if either run does not exist
     */
    public RunComparison compareRuns(String runId1, String runId2) {
        EtlRun first = findRun(runId1)
                .orElseThrow(() -> new IllegalArgumentException("Run not found: " + runId1));
        EtlRun second = findRun(runId2)
                .orElseThrow(() -> new IllegalArgumentException("Run not found: " + runId2));

        Map<String, Delta> differences = new LinkedHashMap<>();
        List<Anomaly> anomalies = new ArrayList<>();

        if (first.getRecordsLoaded() > 0 && second.getRecordsLoaded() > 0) {
            double diff = second.getRecordsLoaded() - first.getRecordsLoaded();
            double pct = diff / first.getRecordsLoaded() * 100;
            differences.put("records_loaded", new Delta(diff, pct));
            if (Math.abs(pct) > 50) {
                anomalies.add(new Anomaly("record_count_anomaly",
                        String.format("Record count changed by %.1f%%", pct),
                        Math.abs(pct) > 90 ? Severity.HIGH : Severity.MEDIUM));
            }
        }

        Double d1 = first.getDurationSeconds();
        Double d2 = second.getDurationSeconds();
        if (d1 != null && d2 != null && d1 > 0 && d2 > 0) {
            double diff = d2 - d1;
            double pct = diff / d1 * 100;
            differences.put("duration", new Delta(diff, pct));
            if (pct > 100) {
                anomalies.add(new Anomaly("duration_anomaly",
                        String.format("Run took %.1f%% longer", pct), Severity.MEDIUM));
            }
        }

        if (first.getStatus() != second.getStatus()) {
            anomalies.add(new Anomaly("status_change",
                    "Status changed from " + first.getStatus().value() + " to " + second.getStatus().value(),
                    second.getStatus() == RunStatus.FAILED ? Severity.HIGH : Severity.LOW));
        }

        return new RunComparison(RunSnapshot.of(first), RunSnapshot.of(second), differences, anomalies);
    }

    private EtlRun mapRow(ResultSet rs, int rowNum) throws SQLException {
        Timestamp completed = rs.getTimestamp("completed_at");
        double duration = rs.getDouble("duration_seconds");
        boolean durationNull = rs.wasNull();
        return EtlRun.builder()
                .runId(rs.getString("run_id"))
                .sourceType(SourceType.fromValue(rs.getString("source_type")))
                .status(RunStatus.fromValue(rs.getString("status")))
                .startedAt(rs.getTimestamp("started_at").toLocalDateTime())
                .completedAt(completed != null ? completed.toLocalDateTime() : null)
                .durationSeconds(durationNull ? null : duration)
                .recordsExtracted(rs.getInt("records_extracted"))
                .recordsTransformed(rs.getInt("records_transformed"))
                .recordsLoaded(rs.getInt("records_loaded"))
                .recordsSkipped(rs.getInt("records_skipped"))
                .recordsFailed(rs.getInt("records_failed"))
                .errorMessage(rs.getString("error_message"))
                .errorTrace(rs.getString("error_trace"))
                .checkpointData(json.readMap(rs.getString("checkpoint_data")))
                .metadata(json.readMap(rs.getString("run_metadata")))
                .build();
    }

    private static String stackTrace(Throwable error) {
        StringWriter out = new StringWriter();
        error.printStackTrace(new PrintWriter(out));
        return out.toString();
    }

    /** Final counters handed to {@link #completeRun}. */
    public record RunCounts(int extracted, int transformed, int loaded, int skipped, int failed) {}
}
