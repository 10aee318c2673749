package com.propertyintel.ingest.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Builder
public class SchemaDriftRecord {

    private Long id;
    private SourceType sourceType;
    private String fieldName;
    private DriftType driftType;
    private String expectedType;
    private String actualType;
    private double confidenceScore;
    private String sampleValue;     // truncated to 200 chars
    private LocalDateTime detectedAt;
    private boolean resolved;
    private LocalDateTime resolvedAt;
}
