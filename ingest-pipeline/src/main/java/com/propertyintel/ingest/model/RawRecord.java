package com.propertyintel.ingest.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Source payload as received, stored in raw_records.
 * Unique on (source_type, source_id); re-ingesting overwrites payload and checksum.
 */
@Data
@Builder
public class RawRecord {

    private Long id;
    private SourceType sourceType;
    private String sourceId;
    private Map<String, Object> payload;
    private String checksum;        // SHA-256 of the key-sorted payload JSON
    private String sourceRef;       // file name, feed URL or endpoint
    private LocalDateTime ingestedAt;
}
