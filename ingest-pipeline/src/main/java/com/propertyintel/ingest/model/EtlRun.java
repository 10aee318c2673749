package com.propertyintel.ingest.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * One ingestion run for a single source. Stored in etl_runs.
 * Written at start, completed once, never touched again.
 */
@Data
@Builder
public class EtlRun {

    private String runId;           // UUID
    private SourceType sourceType;
    private RunStatus status;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private Double durationSeconds;

    private int recordsExtracted;
    private int recordsTransformed;
    private int recordsLoaded;
    private int recordsSkipped;
    private int recordsFailed;

    private String errorMessage;    // null on success
    private String errorTrace;
    private Map<String, Object> checkpointData;
    private Map<String, Object> metadata;
}
