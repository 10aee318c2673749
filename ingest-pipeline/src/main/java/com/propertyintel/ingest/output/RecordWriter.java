package com.propertyintel.ingest.output;

import com.propertyintel.ingest.model.RawRecord;
import com.propertyintel.ingest.model.SourceType;
import com.propertyintel.ingest.model.UnifiedRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Idempotent writes of raw and unified records.
 *
 * Each upsert is an UPDATE by natural key followed by an INSERT when nothing
 * matched, then a lookup of the row id. Callers run both writes for a record in
 * one transaction; a source type has a single writer, so the key cannot be
 * inserted concurrently.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RecordWriter {

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final Clock clock;

    /**
     * Insert or overwrite payload, checksum and ingest time.
     *
     * @return the raw row id
     */
    public long upsertRaw(RawRecord record) {
        Timestamp now = Timestamp.valueOf(LocalDateTime.now(clock));
        String payload = json.write(record.getPayload());
        if (payload == null) {
            payload = "{}";
        }
        String type = record.getSourceType().value();

        int updated = jdbcTemplate.update("""
                UPDATE raw_records
                   SET payload = ?, checksum = ?, source_ref = ?, ingested_at = ?
                 WHERE source_type = ? AND source_id = ?
                """,
                payload, record.getChecksum(), record.getSourceRef(), now,
                type, record.getSourceId());

        if (updated == 0) {
            jdbcTemplate.update("""
                    INSERT INTO raw_records
                    (source_type, source_id, payload, checksum, source_ref, ingested_at)
                    VALUES (?, ?, ?, ?, ?, ?)
                    """,
                    type, record.getSourceId(), payload, record.getChecksum(), record.getSourceRef(), now);
        }

        Long id = jdbcTemplate.queryForObject(
                "SELECT id FROM raw_records WHERE source_type = ? AND source_id = ?",
                Long.class, type, record.getSourceId());
        log.debug("Raw {} {} -> id {} ({})", type, record.getSourceId(), id, updated == 0 ? "inserted" : "updated");
        return id;
    }

    /**
     * Insert or replace the unified row keyed on (source_type, source_id).
     * created_at survives updates.
     *
     * @return the unified row id
     */
    public long upsertUnified(UnifiedRecord record) {
        Timestamp now = Timestamp.valueOf(LocalDateTime.now(clock));
        String type = record.getSourceType().value();
        Timestamp publishedAt = record.getPublishedAt() != null ? Timestamp.valueOf(record.getPublishedAt()) : null;
        String tags = json.write(record.getTags());
        String extra = json.write(record.getExtraData());

        int updated = jdbcTemplate.update("""
                UPDATE unified_records
                   SET raw_id = ?, title = ?, description = ?, content = ?, author = ?, category = ?,
                       tags = ?, url = ?, published_at = ?, extra_data = ?, updated_at = ?
                 WHERE source_type = ? AND source_id = ?
                """,
                record.getRawId(), record.getTitle(), record.getDescription(), record.getContent(),
                record.getAuthor(), record.getCategory(), tags, record.getUrl(), publishedAt, extra, now,
                type, record.getSourceId());

        if (updated == 0) {
            jdbcTemplate.update("""
                    INSERT INTO unified_records
                    (source_type, source_id, raw_id, title, description, content, author, category,
                     tags, url, published_at, extra_data, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """,
                    type, record.getSourceId(), record.getRawId(), record.getTitle(), record.getDescription(),
                    record.getContent(), record.getAuthor(), record.getCategory(), tags, record.getUrl(),
                    publishedAt, extra, now, now);
        }

        return jdbcTemplate.queryForObject(
                "SELECT id FROM unified_records WHERE source_type = ? AND source_id = ?",
                Long.class, type, record.getSourceId());
    }

    public Optional<UnifiedRecord> findUnified(SourceType sourceType, String sourceId) {
        List<UnifiedRecord> rows = jdbcTemplate.query(
                "SELECT * FROM unified_records WHERE source_type = ? AND source_id = ?",
                this::mapUnified, sourceType.value(), sourceId);
        return rows.stream().findFirst();
    }

    public List<UnifiedRecord> findUnifiedBySource(SourceType sourceType) {
        return jdbcTemplate.query(
                "SELECT * FROM unified_records WHERE source_type = ? ORDER BY id",
                this::mapUnified, sourceType.value());
    }

    public long countUnified(SourceType sourceType) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM unified_records WHERE source_type = ?", Long.class, sourceType.value());
        return count == null ? 0 : count;
    }

    public long countRaw(SourceType sourceType) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM raw_records WHERE source_type = ?", Long.class, sourceType.value());
        return count == null ? 0 : count;
    }

    private UnifiedRecord mapUnified(ResultSet rs, int rowNum) throws SQLException {
        Map<String, Object> extra = json.readMap(rs.getString("extra_data"));
        return UnifiedRecord.builder()
                .id(rs.getLong("id"))
                .sourceType(SourceType.fromValue(rs.getString("source_type")))
                .sourceId(rs.getString("source_id"))
                .rawId(rs.getLong("raw_id"))
                .title(rs.getString("title"))
                .description(rs.getString("description"))
                .content(rs.getString("content"))
                .author(rs.getString("author"))
                .category(rs.getString("category"))
                .tags(json.readStringList(rs.getString("tags")))
                .url(rs.getString("url"))
                .publishedAt(toLocal(rs.getTimestamp("published_at")))
                .extraData(extra != null ? extra : Map.of())
                .createdAt(toLocal(rs.getTimestamp("created_at")))
                .updatedAt(toLocal(rs.getTimestamp("updated_at")))
                .build();
    }

    static LocalDateTime toLocal(Timestamp ts) {
        return ts == null ? null : ts.toLocalDateTime();
    }
}
