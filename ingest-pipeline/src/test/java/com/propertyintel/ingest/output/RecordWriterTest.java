package com.propertyintel.ingest.output;

import com.propertyintel.ingest.model.RawRecord;
import com.propertyintel.ingest.model.SourceType;
import com.propertyintel.ingest.model.UnifiedRecord;
import com.propertyintel.ingest.support.MutableClock;
import com.propertyintel.ingest.support.TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RecordWriterTest {

    private TestDatabase db;
    private MutableClock clock;
    private RecordWriter writer;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create();
        clock = MutableClock.at("2024-01-15T10:00:00Z");
        writer = new RecordWriter(db.jdbc, db.json, clock);
    }

    @Test
    void rawUpsertKeepsIdAndOverwritesPayload() {
        long first = writer.upsertRaw(raw("k1", Map.of("v", 1), "c1"));
        long second = writer.upsertRaw(raw("k1", Map.of("v", 2), "c2"));

        assertThat(second).isEqualTo(first);
        assertThat(writer.countRaw(SourceType.API)).isEqualTo(1);
        Map<String, Object> row = db.jdbc.queryForMap("SELECT payload, checksum FROM raw_records WHERE id = ?", first);
        assertThat(row.get("payload")).isEqualTo("{\"v\":2}");
        assertThat(row.get("checksum")).isEqualTo("c2");
    }

    @Test
    void emptyPayloadIsStoredAsEmptyObject() {
        long id = writer.upsertRaw(raw("k1", Map.of(), "c"));

        assertThat(db.jdbc.queryForObject("SELECT payload FROM raw_records WHERE id = ?", String.class, id))
                .isEqualTo("{}");
    }

    @Test
    void sameSourceIdInAnotherTypeIsAnotherRow() {
        long api = writer.upsertRaw(raw("k1", Map.of("v", 1), "c"));
        long feed = writer.upsertRaw(RawRecord.builder()
                .sourceType(SourceType.FEED).sourceId("k1").payload(Map.of("v", 1)).checksum("c").build());

        assertThat(feed).isNotEqualTo(api);
    }

    @Test
    void unifiedUpsertReplacesFieldsButKeepsCreatedAt() {
        long id = writer.upsertUnified(unified("7", "Old title", List.of("a")));
        clock.advance(Duration.ofHours(1));

        long again = writer.upsertUnified(unified("7", "New title", List.of()));

        assertThat(again).isEqualTo(id);
        UnifiedRecord stored = writer.findUnified(SourceType.FILE, "7").orElseThrow();
        assertThat(stored.getTitle()).isEqualTo("New title");
        assertThat(stored.getTags()).isNull();
        assertThat(stored.getCreatedAt()).isEqualTo(LocalDateTime.of(2024, 1, 15, 10, 0));
        assertThat(stored.getUpdatedAt()).isEqualTo(LocalDateTime.of(2024, 1, 15, 11, 0));
        assertThat(writer.countUnified(SourceType.FILE)).isEqualTo(1);
    }

    @Test
    void unifiedRoundTripsJsonColumns() {
        UnifiedRecord record = unified("9", "T", List.of("x", "y")).toBuilder()
                .extraData(Map.of("price", 1.5, "symbol", "BTC"))
                .publishedAt(LocalDateTime.of(2024, 1, 1, 8, 0))
                .build();

        writer.upsertUnified(record);

        UnifiedRecord stored = writer.findUnifiedBySource(SourceType.FILE).get(0);
        assertThat(stored.getTags()).containsExactly("x", "y");
        assertThat(stored.getExtraData()).containsEntry("price", 1.5).containsEntry("symbol", "BTC");
        assertThat(stored.getPublishedAt()).isEqualTo(LocalDateTime.of(2024, 1, 1, 8, 0));
        assertThat(stored.getRawId()).isEqualTo(42L);
    }

    @Test
    void missingUnifiedIsEmpty() {
        assertThat(writer.findUnified(SourceType.API, "none")).isEmpty();
        assertThat(writer.countUnified(SourceType.API)).isZero();
    }

    private static RawRecord raw(String sourceId, Map<String, Object> payload, String checksum) {
        return RawRecord.builder()
                .sourceType(SourceType.API)
                .sourceId(sourceId)
                .payload(payload)
                .checksum(checksum)
                .sourceRef("https://api.test")
                .build();
    }

    private static UnifiedRecord unified(String sourceId, String title, List<String> tags) {
        return UnifiedRecord.builder()
                .sourceType(SourceType.FILE)
                .sourceId(sourceId)
                .rawId(42L)
                .title(title)
                .tags(tags)
                .extraData(Map.of())
                .build();
    }
}
