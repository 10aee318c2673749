package com.propertyintel.ingest.extract;

import com.propertyintel.ingest.config.IngestProperties;
import com.propertyintel.ingest.model.Checkpoint;
import com.propertyintel.ingest.model.DriftResult;
import com.propertyintel.ingest.model.EtlRun;
import com.propertyintel.ingest.model.ExtractionResult;
import com.propertyintel.ingest.model.RunStatus;
import com.propertyintel.ingest.model.SourceType;
import com.propertyintel.ingest.model.UnifiedRecord;
import com.propertyintel.ingest.output.RecordWriter;
import com.propertyintel.ingest.service.CheckpointManager;
import com.propertyintel.ingest.service.RunTracker;
import com.propertyintel.ingest.service.SchemaDriftDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Runs one extractor end to end.
 *
 * <ol>
 *   <li>Read the checkpoint once and open a run carrying a snapshot of it.</li>
 *   <li>Pull raw records in source order. Each one is filtered against the cursor,
 *       checked for drift, then raw row, transform and unified row are written in
 *       one transaction.</li>
 *   <li>A failing record is counted and the run moves on. A failure of the stream
 *       itself fails the run, keeps the cursor at the last loaded record and is rethrown.</li>
 *   <li>After a complete pass the cursor advances and the run is closed as
 *       success, or partial when any record failed.</li>
 * </ol>
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ExtractionDriver {

    private final CheckpointManager checkpointManager;
    private final RunTracker runTracker;
    private final SchemaDriftDetector driftDetector;
    private final RecordWriter recordWriter;
    private final TransactionTemplate transactionTemplate;
    private final IngestProperties properties;

    public ExtractionResult run(SourceExtractor extractor) {
        SourceType type = extractor.sourceType();
        Checkpoint checkpoint = checkpointManager.getCheckpoint(type).orElse(null);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("extractor", extractor.name());
        metadata.put("checkpoint", snapshot(checkpoint));
        EtlRun run = runTracker.startRun(type, metadata);

        RunCounters counters = new RunCounters();
        Progress progress = new Progress();
        ExtractionContext context = new ExtractionContext(run.getRunId(), checkpoint, counters);

        try (MDC.MDCCloseable runId = MDC.putCloseable("runId", run.getRunId());
             MDC.MDCCloseable source = MDC.putCloseable("sourceType", type.value())) {

            try (Stream<Map<String, Object>> records = extractor.extract(context)) {
                Iterator<Map<String, Object>> it = records.iterator();
                while (it.hasNext()) {
                    RecordOutcome outcome = process(extractor, checkpoint, it.next(), counters);
                    if (outcome.isLoaded()) {
                        progress.advance(outcome.sourceId(), outcome.progressKey(), outcome.offset());
                    }
                }
                saveProgress(extractor, checkpoint, progress, counters, true);
            } catch (RuntimeException e) {
                log.error("ETL run failed for {}: {}", extractor.name(), e.getMessage(), e);
                if (!progress.saved) {
                    try {
                        saveProgress(extractor, checkpoint, progress, counters, false);
                    } catch (RuntimeException checkpointFailure) {
                        e.addSuppressed(checkpointFailure);
                    }
                }
                runTracker.completeRun(run, RunStatus.FAILED, counters.snapshot(), e, progress.checkpointData());
                throw e;
            }

            RunStatus status = counters.getFailed() == 0 ? RunStatus.SUCCESS : RunStatus.PARTIAL;
            runTracker.completeRun(run, status, counters.snapshot(), null, progress.checkpointData());

            log.info("{} finished: {} extracted, {} loaded, {} skipped, {} failed",
                    extractor.name(), counters.getExtracted(), counters.getLoaded(),
                    counters.getSkipped(), counters.getFailed());

            return new ExtractionResult(run.getRunId(), type, status,
                    counters.getExtracted(), counters.getTransformed(), counters.getLoaded(),
                    counters.getSkipped(), counters.getFailed());
        }
    }

    /**
     * True when there is no cursor or {@code sourceId} sorts after it.
     * The comparison is on strings, so numeric ids of different widths do not order
     * numerically ("test:6" is after "test:50"). Extractors whose ids carry numbers
     * pad them to a fixed width.
     */
    public static boolean shouldProcess(Checkpoint checkpoint, String sourceId) {
        if (checkpoint == null || checkpoint.getLastSourceId() == null) {
            return true;
        }
        return sourceId.compareTo(checkpoint.getLastSourceId()) > 0;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private RecordOutcome process(SourceExtractor extractor,
                                  Checkpoint checkpoint,
                                  Map<String, Object> raw,
                                  RunCounters counters) {
        SourceType type = extractor.sourceType();
        String sourceId = null;
        try {
            sourceId = extractor.sourceId(raw);

            if (extractor.filtersByCheckpoint() && !shouldProcess(checkpoint, sourceId)) {
                counters.countSkipped();
                return RecordOutcome.skipped(sourceId);
            }
            counters.countExtracted();

            if (properties.getDrift().isEnabled()) {
                List<DriftResult> drifts = driftDetector.detectDrift(type, raw);
                driftDetector.recordDrifts(type, drifts);
            }

            String id = sourceId;
            transactionTemplate.executeWithoutResult(status -> {
                long rawId = recordWriter.upsertRaw(extractor.toRawRecord(raw, id));
                UnifiedRecord unified = extractor.transform(raw);
                counters.countTransformed();
                recordWriter.upsertUnified(unified.toBuilder()
                        .sourceType(type)
                        .sourceId(String.valueOf(rawId))
                        .rawId(rawId)
                        .build());
            });
            counters.countLoaded();
            return RecordOutcome.loaded(sourceId, extractor.progressKey(raw), extractor.offsetOf(raw));

        } catch (RuntimeException e) {
            log.error("Error processing record {}: {}", sourceId, e.getMessage(), e);
            counters.countFailed();
            return RecordOutcome.failed(sourceId, e.getMessage());
        }
    }

    private void saveProgress(SourceExtractor extractor,
                              Checkpoint checkpoint,
                              Progress progress,
                              RunCounters counters,
                              boolean completed) {
        progress.saved = true;
        if (progress.lastSourceId == null) {
            return;
        }
        String cursor = extractor.checkpointCursor(progress.firstSourceId, progress.lastSourceId, completed);
        if (cursor == null && progress.lastOffset == null) {
            return;
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("records_processed", counters.getLoaded());
        metadata.put("completed", completed);
        Map<String, Object> offsets = ExtractionContext.storedOffsets(checkpoint);
        offsets.putAll(progress.offsets);
        if (!offsets.isEmpty()) {
            metadata.put(ExtractionContext.OFFSETS, offsets);
        }
        checkpointManager.updateCheckpoint(extractor.sourceType(), cursor, progress.lastOffset, metadata);
    }

    private static Map<String, Object> snapshot(Checkpoint checkpoint) {
        if (checkpoint == null) {
            return null;
        }
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("last_source_id", checkpoint.getLastSourceId());
        snapshot.put("last_offset", checkpoint.getLastOffset());
        snapshot.put("last_processed_at",
                checkpoint.getLastProcessedAt() != null ? checkpoint.getLastProcessedAt().toString() : null);
        return snapshot;
    }

    /** Loaded-record positions seen so far in this run. */
    private static final class Progress {
        private String firstSourceId;
        private String lastSourceId;
        private Long lastOffset;
        private final Map<String, Object> offsets = new LinkedHashMap<>();
        private boolean saved;

        void advance(String sourceId, String progressKey, Long offset) {
            if (firstSourceId == null) {
                firstSourceId = sourceId;
            }
            lastSourceId = sourceId;
            if (offset != null) {
                lastOffset = offset;
                if (progressKey != null) {
                    offsets.put(progressKey, offset);
                }
            }
        }

        Map<String, Object> checkpointData() {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("last_source_id", lastSourceId);
            if (lastOffset != null) {
                data.put("last_offset", lastOffset);
            }
            if (!offsets.isEmpty()) {
                data.put(ExtractionContext.OFFSETS, offsets);
            }
            return data;
        }
    }
}
