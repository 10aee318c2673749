package com.propertyintel.ingest.extract;

/**
 * What happened to a single raw record. Per-record problems end up here;
 * only source-level failures are thrown.
 */
record RecordOutcome(Kind kind, String sourceId, String progressKey, Long offset, String reason) {

    enum Kind { LOADED, SKIPPED, FAILED }

    static RecordOutcome loaded(String sourceId, String progressKey, Long offset) {
        return new RecordOutcome(Kind.LOADED, sourceId, progressKey, offset, null);
    }

    static RecordOutcome skipped(String sourceId) {
        return new RecordOutcome(Kind.SKIPPED, sourceId, null, null, "at or before checkpoint");
    }

    static RecordOutcome failed(String sourceId, String reason) {
        return new RecordOutcome(Kind.FAILED, sourceId, null, null, reason);
    }

    boolean isLoaded() {
        return kind == Kind.LOADED;
    }
}
