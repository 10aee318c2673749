package com.propertyintel.ingest.service;

import com.propertyintel.ingest.exception.CheckpointException;
import com.propertyintel.ingest.model.Checkpoint;
import com.propertyintel.ingest.model.SourceType;
import com.propertyintel.ingest.output.JsonColumns;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-source-type cursor for incremental ingestion, one row per type in etl_checkpoints.
 *
 * Every store failure is rethrown as {@link CheckpointException}; a pipeline that
 * cannot read or write its cursor must not carry on.
 */
@Service
@Slf4j
public class CheckpointManager {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final JsonColumns json;
    private final Clock clock;

    public CheckpointManager(JdbcTemplate jdbcTemplate,
                             TransactionTemplate transactionTemplate,
                             JsonColumns json,
                             Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.json = json;
        this.clock = clock;
    }

    public Optional<Checkpoint> getCheckpoint(SourceType sourceType) {
        try {
            List<Checkpoint> rows = jdbcTemplate.query(
                    "SELECT * FROM etl_checkpoints WHERE source_type = ?",
                    this::mapRow, sourceType.value());
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            log.error("Error getting checkpoint for {}: {}", sourceType.value(), e.getMessage());
            throw new CheckpointException("Failed to get checkpoint: " + e.getMessage(), e);
        }
    }

    public String getLastSourceId(SourceType sourceType) {
        return getCheckpoint(sourceType).map(Checkpoint::getLastSourceId).orElse(null);
    }

    public long getLastOffset(SourceType sourceType) {
        return getCheckpoint(sourceType).map(Checkpoint::getLastOffset).orElse(0L);
    }

    /**
     * Creates the checkpoint if absent, otherwise patches only the non-null arguments.
     * last_processed_at is stamped either way.
     */
    public Checkpoint updateCheckpoint(SourceType sourceType,
                                       String lastSourceId,
                                       Long lastOffset,
                                       Map<String, Object> metadata) {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                Timestamp now = Timestamp.valueOf(LocalDateTime.now(clock));
                String type = sourceType.value();
                Integer existing = jdbcTemplate.queryForObject(
                        "SELECT COUNT(*) FROM etl_checkpoints WHERE source_type = ?", Integer.class, type);

                if (existing == null || existing == 0) {
                    jdbcTemplate.update("""
                            INSERT INTO etl_checkpoints
                            (source_type, last_source_id, last_offset, last_processed_at, checkpoint_metadata, updated_at)
                            VALUES (?, ?, ?, ?, ?, ?)
                            """,
                            type, lastSourceId, lastOffset != null ? lastOffset : 0L, now, json.write(metadata), now);
                    return;
                }

                if (lastSourceId != null) {
                    jdbcTemplate.update("UPDATE etl_checkpoints SET last_source_id = ? WHERE source_type = ?",
                            lastSourceId, type);
                }
                if (lastOffset != null) {
                    jdbcTemplate.update("UPDATE etl_checkpoints SET last_offset = ? WHERE source_type = ?",
                            lastOffset, type);
                }
                if (metadata != null) {
                    jdbcTemplate.update("UPDATE etl_checkpoints SET checkpoint_metadata = ? WHERE source_type = ?",
                            json.write(metadata), type);
                }
                jdbcTemplate.update(
                        "UPDATE etl_checkpoints SET last_processed_at = ?, updated_at = ? WHERE source_type = ?",
                        now, now, type);
            });
        } catch (DataAccessException e) {
            log.error("Error updating checkpoint for {}: {}", sourceType.value(), e.getMessage());
            throw new CheckpointException("Failed to update checkpoint: " + e.getMessage(), e);
        }

        log.info("Checkpoint updated for {}: source_id={}, offset={}", sourceType.value(), lastSourceId, lastOffset);
        return getCheckpoint(sourceType)
                .orElseThrow(() -> new CheckpointException("Checkpoint vanished after update: " + sourceType.value(), null));
    }

    /** Clears the cursor so the next run reprocesses everything. The row is kept. */
    public void resetCheckpoint(SourceType sourceType) {
        try {
            int updated = jdbcTemplate.update("""
                    UPDATE etl_checkpoints
                       SET last_source_id = NULL, last_offset = 0, last_processed_at = NULL,
                           checkpoint_metadata = NULL, updated_at = ?
                     WHERE source_type = ?
                    """,
                    Timestamp.valueOf(LocalDateTime.now(clock)), sourceType.value());
            if (updated > 0) {
                log.info("Checkpoint reset for {}", sourceType.value());
            }
        } catch (DataAccessException e) {
            log.error("Error resetting checkpoint for {}: {}", sourceType.value(), e.getMessage());
            throw new CheckpointException("Failed to reset checkpoint: " + e.getMessage(), e);
        }
    }

    /** Keyed by source type value, in table order. */
    public Map<String, Checkpoint> getAllCheckpoints() {
        try {
            Map<String, Checkpoint> all = new LinkedHashMap<>();
            jdbcTemplate.query("SELECT * FROM etl_checkpoints ORDER BY id", this::mapRow)
                    .forEach(cp -> all.put(cp.getSourceType().value(), cp));
            return all;
        } catch (DataAccessException e) {
            log.error("Error getting all checkpoints: {}", e.getMessage());
            throw new CheckpointException("Failed to get checkpoints: " + e.getMessage(), e);
        }
    }

    private Checkpoint mapRow(ResultSet rs, int rowNum) throws SQLException {
        Timestamp processed = rs.getTimestamp("last_processed_at");
        Timestamp updated = rs.getTimestamp("updated_at");
        return Checkpoint.builder()
                .sourceType(SourceType.fromValue(rs.getString("source_type")))
                .lastSourceId(rs.getString("last_source_id"))
                .lastOffset(rs.getLong("last_offset"))
                .lastProcessedAt(processed != null ? processed.toLocalDateTime() : null)
                .metadata(json.readMap(rs.getString("checkpoint_metadata")))
                .updatedAt(updated != null ? updated.toLocalDateTime() : null)
                .build();
    }
}
