package com.propertyintel.ingest.model;

/**
 * Per-source entry of an orchestrated run. {@code result} is null when the
 * extractor failed before it could report counters.
 */
public record SourceRunResult(
        SourceType sourceType,
        String extractor,
        String status,
        ExtractionResult result,
        String error,
        Integer recordsBeforeFailure) {

    public static final String STATUS_FAILED = "failed";
    public static final String STATUS_FAILED_INJECTION = "failed_injection";

    public static SourceRunResult completed(String extractor, ExtractionResult result) {
        return new SourceRunResult(result.sourceType(), extractor, result.status().value(), result, null, null);
    }

    public static SourceRunResult failed(SourceType sourceType, String extractor, Throwable error) {
        return new SourceRunResult(sourceType, extractor, STATUS_FAILED, null, error.getMessage(), null);
    }

    public boolean isSuccess() {
        return RunStatus.SUCCESS.value().equals(status);
    }

    public boolean isFailed() {
        return STATUS_FAILED.equals(status) || STATUS_FAILED_INJECTION.equals(status);
    }
}
