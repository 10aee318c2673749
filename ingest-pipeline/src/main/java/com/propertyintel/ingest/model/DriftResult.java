package com.propertyintel.ingest.model;

/**
 * A single mismatch between a record and its expected schema, before it is persisted.
 */
public record DriftResult(
        String fieldName,
        DriftType driftType,
        String expectedType,
        String actualType,
        double confidenceScore,
        String sampleValue) {
}
