package com.propertyintel.ingest.model;

/**
 * Final counters of one extractor run, as returned to the orchestrator.
 */
public record ExtractionResult(
        String runId,
        SourceType sourceType,
        RunStatus status,
        int recordsExtracted,
        int recordsTransformed,
        int recordsLoaded,
        int recordsSkipped,
        int recordsFailed) {
}
