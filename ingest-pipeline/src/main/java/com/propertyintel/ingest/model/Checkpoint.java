package com.propertyintel.ingest.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Incremental cursor, one row per source type in etl_checkpoints.
 */
@Data
@Builder
public class Checkpoint {

    private SourceType sourceType;
    private String lastSourceId;    // compared as a plain string
    private long lastOffset;        // source-local position, e.g. CSV row number
    private LocalDateTime lastProcessedAt;
    private Map<String, Object> metadata;
    private LocalDateTime updatedAt;
}
