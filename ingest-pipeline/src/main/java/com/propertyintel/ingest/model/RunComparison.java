package com.propertyintel.ingest.model;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Read-only diff of two runs, used to spot anomalies between consecutive runs.
 */
public record RunComparison(
        RunSnapshot first,
        RunSnapshot second,
        Map<String, Delta> differences,
        List<Anomaly> anomalies) {

    public record RunSnapshot(
            String runId,
            SourceType sourceType,
            RunStatus status,
            int recordsLoaded,
            Double durationSeconds,
            LocalDateTime startedAt) {

        public static RunSnapshot of(EtlRun run) {
            return new RunSnapshot(run.getRunId(), run.getSourceType(), run.getStatus(),
                    run.getRecordsLoaded(), run.getDurationSeconds(), run.getStartedAt());
        }
    }

    public record Delta(double absolute, double percentage) {}

    public record Anomaly(String type, String description, Severity severity) {}

    public enum Severity { LOW, MEDIUM, HIGH }
}
