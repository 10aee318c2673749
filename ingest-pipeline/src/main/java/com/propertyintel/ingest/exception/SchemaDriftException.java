package com.propertyintel.ingest.exception;

import java.util.Map;

/**
 * Drift could not be recorded. The detector logs these instead of raising them,
 * so drift handling never stops ingestion.
 */
public class SchemaDriftException extends IngestException {

    private final Map<String, Object> driftDetails;

    public SchemaDriftException(String message, Map<String, Object> driftDetails, Throwable cause) {
        super(message, cause);
        this.driftDetails = driftDetails == null ? Map.of() : Map.copyOf(driftDetails);
    }

    public Map<String, Object> getDriftDetails() {
        return driftDetails;
    }
}
