package com.propertyintel.ingest.extract;

import com.propertyintel.ingest.model.RawRecord;
import com.propertyintel.ingest.model.SourceType;
import com.propertyintel.ingest.model.UnifiedRecord;

import java.util.Map;
import java.util.stream.Stream;

/**
 * One ingestion channel. Implementations only know their source: fetching, identity
 * and mapping. The run lifecycle (checkpoint filter, drift, dual write, run
 * bookkeeping) lives in {@link ExtractionDriver}.
 */
public interface SourceExtractor {

    SourceType sourceType();

    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Lazy, finite stream of raw records in source order. The driver closes the
     * stream on every exit path, so implementations attach their handles with
     * {@link Stream#onClose}. Source-level failures are thrown while iterating.
     */
    Stream<Map<String, Object>> extract(ExtractionContext context);

    /** Deterministic identity of a raw record within this source type. */
    String sourceId(Map<String, Object> raw);

    /**
     * Maps a raw record to the unified shape. Must tolerate any missing field.
     * Source type, source id and raw id are filled in by the driver.
     */
    UnifiedRecord transform(Map<String, Object> raw);

    /** Diagnostic reference stored with raw rows (file name, feed URL, endpoint). */
    default String sourceRef() {
        return null;
    }

    default RawRecord toRawRecord(Map<String, Object> raw, String sourceId) {
        return RawRecord.builder()
                .sourceType(sourceType())
                .sourceId(sourceId)
                .payload(raw)
                .checksum(Checksums.sha256(raw))
                .sourceRef(sourceRef())
                .build();
    }

    /** Source-local position of the record, stored as the checkpoint offset. Null when not applicable. */
    default Long offsetOf(Map<String, Object> raw) {
        return null;
    }

    /**
     * Which stream of the source {@link #offsetOf} counts in, e.g. the file a row came from.
     * Offsets are stored per key, see {@link ExtractionContext#lastOffset(String)}.
     */
    default String progressKey(Map<String, Object> raw) {
        return null;
    }

    /** Whether records are dropped by comparing their id with the stored cursor. */
    default boolean filtersByCheckpoint() {
        return true;
    }

    /**
     * Cursor to store after a run, given the first and last loaded ids in emission order.
     * Null leaves the stored cursor untouched.
     */
    default String checkpointCursor(String firstLoadedId, String lastLoadedId, boolean completed) {
        return lastLoadedId;
    }
}
