package com.propertyintel.ingest.service;

import com.propertyintel.ingest.config.IngestProperties;
import com.propertyintel.ingest.exception.SchemaDriftException;
import com.propertyintel.ingest.model.DriftResult;
import com.propertyintel.ingest.model.DriftType;
import com.propertyintel.ingest.model.SchemaDriftRecord;
import com.propertyintel.ingest.model.SourceType;
import com.propertyintel.ingest.model.ValueType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compares the shape of incoming raw records with an expected field → type-tag schema.
 *
 * Unknown fields close enough to an expected name (similarity ratio at or above the
 * confidence threshold) are reported as renames; the rest are new fields. Expected
 * fields with no close counterpart are missing. Shared fields whose value type is
 * neither equal nor a configured compatible pair are type changes.
 *
 * Detection is pure. Persisting the results never fails the caller.
 */
@Service
@Slf4j
public class SchemaDriftDetector {

    private static final int SAMPLE_MAX_LENGTH = 200;

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;
    private final double confidenceThreshold;
    private final Set<String> compatiblePairs = new HashSet<>();
    private final Map<SourceType, Map<String, String>> schemas = Collections.synchronizedMap(new EnumMap<>(SourceType.class));

    public SchemaDriftDetector(JdbcTemplate jdbcTemplate, IngestProperties properties, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;

        IngestProperties.Drift drift = properties.getDrift();
        this.confidenceThreshold = drift.getConfidenceThreshold();

        for (String pair : drift.getCompatibleTypes()) {
            String[] parts = pair.split(":");
            if (parts.length != 2) {
                throw new IllegalArgumentException("Compatible type pair must be written a:b, got '" + pair + "'");
            }
            String a = ValueType.fromTag(parts[0]).tag();
            String b = ValueType.fromTag(parts[1]).tag();
            compatiblePairs.add(a + ":" + b);
            compatiblePairs.add(b + ":" + a);
        }

        schemas.putAll(defaultSchemas());
        drift.getExpectedSchemas().forEach((type, schema) ->
                schemas.put(SourceType.fromValue(type), normalise(schema)));
    }

    public List<DriftResult> detectDrift(SourceType sourceType, Map<String, Object> record) {
        Map<String, String> expected = expectedSchema(sourceType);
        Set<String> expectedFields = expected.keySet();
        Set<String> actualFields = new LinkedHashSet<>(record.keySet());

        List<DriftResult> drifts = new ArrayList<>();

        for (String field : actualFields) {
            if (expectedFields.contains(field)) continue;
            Match match = bestMatch(field, expectedFields);
            Object value = record.get(field);
            if (match.score() >= confidenceThreshold) {
                drifts.add(new DriftResult(field, DriftType.RENAMED_FIELD,
                        expected.get(match.field()), ValueType.of(value).tag(),
                        match.score(), sample(value)));
            } else {
                drifts.add(new DriftResult(field, DriftType.NEW_FIELD,
                        null, ValueType.of(value).tag(),
                        match.field() != null ? 1.0 - match.score() : 1.0, sample(value)));
            }
        }

        for (String field : expectedFields) {
            if (actualFields.contains(field)) continue;
            Match match = bestMatch(field, actualFields);
            if (match.score() < confidenceThreshold) {
                drifts.add(new DriftResult(field, DriftType.MISSING_FIELD,
                        expected.get(field), null,
                        match.field() != null ? 1.0 - match.score() : 1.0, null));
            }
        }

        for (String field : actualFields) {
            String expectedType = expected.get(field);
            if (expectedType == null) continue;
            Object value = record.get(field);
            String actualType = ValueType.of(value).tag();
            if (!compatible(expectedType, actualType)) {
                drifts.add(new DriftResult(field, DriftType.TYPE_CHANGE,
                        expectedType, actualType, 1.0, sample(value)));
            }
        }

        return drifts;
    }

    /**
     * Persists each drift to schema_drift with a warning log line.
     * A store failure is logged and dropped.
     *
     * @return the number of rows written
     */
    public int recordDrifts(SourceType sourceType, List<DriftResult> drifts) {
        if (drifts.isEmpty()) return 0;

        Timestamp now = Timestamp.valueOf(LocalDateTime.now(clock));
        for (DriftResult d : drifts) {
            log.warn("Schema drift detected [{}]: {} - {} (expected: {}, actual: {}, confidence: {})",
                    sourceType.value(), d.driftType().value(), d.fieldName(),
                    d.expectedType(), d.actualType(), String.format("%.2f", d.confidenceScore()));
        }

        try {
            jdbcTemplate.batchUpdate("""
                    INSERT INTO schema_drift
                    (source_type, detected_at, field_name, expected_type, actual_type,
                     drift_type, confidence_score, sample_value, resolved)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, FALSE)
                    """,
                    drifts.stream().map(d -> new Object[]{
                            sourceType.value(), now, d.fieldName(), d.expectedType(), d.actualType(),
                            d.driftType().value(), d.confidenceScore(), d.sampleValue()
                    }).toList());
            return drifts.size();
        } catch (DataAccessException e) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("source_type", sourceType.value());
            details.put("drift_count", drifts.size());
            SchemaDriftException failure =
                    new SchemaDriftException("Failed to record schema drifts: " + e.getMessage(), details, e);
            log.error(failure.getMessage(), failure);
            return 0;
        }
    }

    /** Newest first. {@code sourceType} may be null for all types. */
    public List<SchemaDriftRecord> unresolvedDrifts(SourceType sourceType) {
        if (sourceType == null) {
            return jdbcTemplate.query(
                    "SELECT * FROM schema_drift WHERE resolved = FALSE ORDER BY detected_at DESC, id DESC",
                    this::mapRow);
        }
        return jdbcTemplate.query(
                "SELECT * FROM schema_drift WHERE resolved = FALSE AND source_type = ? ORDER BY detected_at DESC, id DESC",
                this::mapRow, sourceType.value());
    }

    /** @return false when no drift has that id */
    public boolean resolveDrift(long driftId) {
        int updated = jdbcTemplate.update(
                "UPDATE schema_drift SET resolved = TRUE, resolved_at = ? WHERE id = ?",
                Timestamp.valueOf(LocalDateTime.now(clock)), driftId);
        return updated > 0;
    }

    public void updateExpectedSchema(SourceType sourceType, Map<String, String> schema) {
        schemas.put(sourceType, normalise(schema));
        log.info("Updated expected schema for {}", sourceType.value());
    }

    public Map<String, String> expectedSchema(SourceType sourceType) {
        return schemas.getOrDefault(sourceType, Map.of());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Match bestMatch(String field, Set<String> candidates) {
        String best = null;
        double bestScore = 0.0;
        for (String candidate : candidates) {
            if (field.equalsIgnoreCase(candidate)) {
                return new Match(candidate, 1.0);
            }
            double score = SimilarityRatio.ratioIgnoreCase(field, candidate);
            if (score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }
        return new Match(best, bestScore);
    }

    private boolean compatible(String expected, String actual) {
        return expected.equals(actual) || compatiblePairs.contains(expected + ":" + actual);
    }

    private static String sample(Object value) {
        if (value == null) return null;
        String s = String.valueOf(value);
        if (s.isEmpty()) return null;
        return s.length() > SAMPLE_MAX_LENGTH ? s.substring(0, SAMPLE_MAX_LENGTH) : s;
    }

    private static Map<String, String> normalise(Map<String, String> schema) {
        Map<String, String> out = new LinkedHashMap<>();
        schema.forEach((field, tag) -> out.put(field, ValueType.fromTag(tag).tag()));
        return Collections.unmodifiableMap(out);
    }

    private static Map<SourceType, Map<String, String>> defaultSchemas() {
        Map<SourceType, Map<String, String>> defaults = new EnumMap<>(SourceType.class);

        Map<String, String> api = new LinkedHashMap<>();
        api.put("id", "str");
        api.put("title", "str");
        api.put("description", "str");
        api.put("content", "str");
        api.put("author", "str");
        api.put("category", "str");
        api.put("tags", "list");
        api.put("url", "str");
        api.put("created_at", "datetime");
        api.put("updated_at", "datetime");
        defaults.put(SourceType.API, Collections.unmodifiableMap(api));

        Map<String, String> file = new LinkedHashMap<>();
        file.put("id", "str");
        file.put("name", "str");
        file.put("description", "str");
        file.put("category", "str");
        file.put("value", "float");
        file.put("date", "datetime");
        file.put("active", "bool");
        defaults.put(SourceType.FILE, Collections.unmodifiableMap(file));

        Map<String, String> feed = new LinkedHashMap<>();
        feed.put("guid", "str");
        feed.put("title", "str");
        feed.put("description", "str");
        feed.put("link", "str");
        feed.put("author", "str");
        feed.put("pubDate", "datetime");
        feed.put("category", "str");
        defaults.put(SourceType.FEED, Collections.unmodifiableMap(feed));

        return defaults;
    }

    private SchemaDriftRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        Timestamp resolvedAt = rs.getTimestamp("resolved_at");
        String driftType = rs.getString("drift_type");
        return SchemaDriftRecord.builder()
                .id(rs.getLong("id"))
                .sourceType(SourceType.fromValue(rs.getString("source_type")))
                .fieldName(rs.getString("field_name"))
                .driftType(DriftType.fromValue(driftType))
                .expectedType(rs.getString("expected_type"))
                .actualType(rs.getString("actual_type"))
                .confidenceScore(rs.getDouble("confidence_score"))
                .sampleValue(rs.getString("sample_value"))
                .detectedAt(rs.getTimestamp("detected_at").toLocalDateTime())
                .resolved(rs.getBoolean("resolved"))
                .resolvedAt(resolvedAt != null ? resolvedAt.toLocalDateTime() : null)
                .build();
    }

    private record Match(String field, double score) {}
}
