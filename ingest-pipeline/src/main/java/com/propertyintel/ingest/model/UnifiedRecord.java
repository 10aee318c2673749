package com.propertyintel.ingest.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Source-agnostic record every extractor produces.
 *
 * Schema design notes:
 *  - unique on (source_type, source_id); source_id is the raw row's storage key
 *  - raw_id is a lookup reference only, there is no foreign key
 *  - extra_data holds whatever has no canonical column
 */
@Data
@Builder(toBuilder = true)
public class UnifiedRecord {

    private Long id;
    private SourceType sourceType;
    private String sourceId;
    private Long rawId;

    // ── Normalised fields ───────────────────────────────────────────────────
    private String title;
    private String description;
    private String content;
    private String author;
    private String category;
    private List<String> tags;
    private String url;
    private LocalDateTime publishedAt;

    /** Fields with no canonical home. Never null once transformed. */
    private Map<String, Object> extraData;

    // ── Metadata ────────────────────────────────────────────────────────────
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
