package com.propertyintel.ingest.extract;

import com.propertyintel.ingest.config.IngestProperties;
import com.propertyintel.ingest.model.Checkpoint;
import com.propertyintel.ingest.model.RawRecord;
import com.propertyintel.ingest.model.SourceType;
import com.propertyintel.ingest.model.UnifiedRecord;
import com.propertyintel.ingest.service.RateLimiter;
import com.propertyintel.ingest.support.MutableClock;
import com.propertyintel.ingest.support.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvFileExtractorTest {

    @TempDir
    Path dir;

    private IngestProperties properties;
    private RateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        properties = new IngestProperties();
        MutableClock clock = MutableClock.at("2024-01-15T10:00:00Z");
        rateLimiter = new RateLimiter(60, 5, 2.0, clock, new RecordingSleeper(clock));
    }

    @Test
    void readsRowsWithTypedCellsAndMetadata() throws IOException {
        CsvFileExtractor extractor = extractorFor("data.csv", """
                id,name,price,active,notes
                1,Widget,9.99,yes,N/A
                2,Gadget,12,false,
                """, StandardCharsets.UTF_8);

        List<Map<String, Object>> rows = extractAll(extractor, null);

        assertThat(rows).hasSize(2);
        Map<String, Object> first = rows.get(0);
        assertThat(first).containsEntry("id", 1L)
                .containsEntry("name", "Widget")
                .containsEntry("price", 9.99)
                .containsEntry("active", true)
                .containsEntry("notes", null)
                .containsEntry(CsvFileExtractor.ROW_NUMBER, 1L)
                .containsEntry(CsvFileExtractor.SOURCE_FILE, "data.csv");
        assertThat(rows.get(1)).containsEntry("price", 12L).containsEntry("active", false);

        assertThat(extractor.sourceId(first)).isEqualTo("data.csv:000000001");
        assertThat(extractor.offsetOf(first)).isEqualTo(1L);
    }

    @Test
    void sourceIdsSortInRowOrder() throws IOException {
        StringBuilder csv = new StringBuilder("id,name\n");
        for (int i = 1; i <= 12; i++) {
            csv.append(i).append(",row").append(i).append('\n');
        }
        CsvFileExtractor extractor = extractorFor("rows.csv", csv.toString(), StandardCharsets.UTF_8);

        List<String> ids = extractAll(extractor, null).stream().map(extractor::sourceId).toList();

        assertThat(ids).isSortedAccordingTo(String::compareTo);
    }

    @Test
    void detectsSemicolonAndTabDelimiters() throws IOException {
        CsvFileExtractor semicolon = extractorFor("eu.csv", """
                id;name;amount
                1;Widget;2,5
                2;Gadget;3,75
                """, StandardCharsets.UTF_8);
        assertThat(extractAll(semicolon, null).get(0))
                .containsEntry("name", "Widget")
                .containsEntry("amount", "2,5");

        CsvFileExtractor tab = extractorFor("tabs.tsv", "id\tname\n1\tWidget\n", StandardCharsets.UTF_8);
        assertThat(extractAll(tab, null).get(0)).containsEntry("name", "Widget");
    }

    @Test
    void fallsBackToLatin1WhenNotUtf8() throws IOException {
        CsvFileExtractor extractor = extractorFor("latin.csv", "id,name\n1,Café\n", StandardCharsets.ISO_8859_1);

        assertThat(extractAll(extractor, null).get(0)).containsEntry("name", "Café");
    }

    @Test
    void stripsByteOrderMarkFromFirstHeader() throws IOException {
        CsvFileExtractor extractor = extractorFor("bom.csv", "\uFEFFid,name\n1,Widget\n", StandardCharsets.UTF_8);

        assertThat(extractAll(extractor, null).get(0)).containsKey("id").containsEntry("name", "Widget");
    }

    @Test
    void resumesAfterStoredOffset() throws IOException {
        CsvFileExtractor extractor = extractorFor("data.csv", """
                id,name
                1,a

                2,b
                3,c
                4,d
                """, StandardCharsets.UTF_8);
        RunCounters counters = new RunCounters();

        List<Map<String, Object>> rows;
        try (Stream<Map<String, Object>> stream =
                     extractor.extract(new ExtractionContext("run", offsets(Map.of("data.csv", 2)), counters))) {
            rows = stream.collect(Collectors.toList());
        }

        assertThat(rows).extracting(r -> r.get("name")).containsExactly("c", "d");
        assertThat(rows.get(0)).containsEntry(CsvFileExtractor.ROW_NUMBER, 3L);
        assertThat(counters.getSkipped()).isEqualTo(2);
    }

    @Test
    void offsetStoredForAnotherFileIsIgnored() throws IOException {
        CsvFileExtractor extractor = extractorFor("new.csv", """
                id,name
                1,a
                2,b
                3,c
                """, StandardCharsets.UTF_8);
        RunCounters counters = new RunCounters();
        Checkpoint cp = offsets(Map.of("old.csv", 2));

        List<Map<String, Object>> rows;
        try (Stream<Map<String, Object>> stream = extractor.extract(new ExtractionContext("run", cp, counters))) {
            rows = stream.collect(Collectors.toList());
        }

        assertThat(rows).extracting(r -> r.get("name")).containsExactly("a", "b", "c");
        assertThat(counters.getSkipped()).isZero();
    }

    @Test
    void readsSeveralFilesInOrderEachFromItsOwnOffset() throws IOException {
        Files.writeString(dir.resolve("first.csv"), "id,name\n1,a\n2,b\n");
        Files.writeString(dir.resolve("second.csv"), "code;label\nx;one\ny;two\n");
        properties.getFile().setPaths(List.of(
                dir.resolve("first.csv").toString(),
                dir.resolve("absent.csv").toString(),
                dir.resolve("second.csv").toString()));
        CsvFileExtractor extractor = new CsvFileExtractor(rateLimiter, properties);

        List<Map<String, Object>> rows = extractAll(extractor, offsets(Map.of("first.csv", 1)));

        assertThat(rows).extracting(r -> r.get(CsvFileExtractor.SOURCE_FILE))
                .containsExactly("first.csv", "second.csv", "second.csv");
        assertThat(rows.get(0)).containsEntry("name", "b");
        assertThat(rows.get(1)).containsEntry("label", "one").containsEntry(CsvFileExtractor.ROW_NUMBER, 1L);
        assertThat(rows).extracting(extractor::progressKey)
                .containsExactly("first.csv", "second.csv", "second.csv");
        assertThat(extractor.filtersByCheckpoint()).isFalse();
        assertThat(extractor.sourceRef()).isEqualTo("first.csv,absent.csv,second.csv");
    }

    @Test
    void pathsTakePrecedenceOverSinglePath() {
        properties.getFile().setPath("/data/single.csv");
        properties.getFile().setPaths(List.of("/data/a.csv", " ", "/data/b.csv"));

        CsvFileExtractor extractor = new CsvFileExtractor(rateLimiter, properties);

        assertThat(extractor.paths()).containsExactly(Path.of("/data/a.csv"), Path.of("/data/b.csv"));
    }

    @Test
    void sameFileNameInTwoDirectoriesIsRejected() {
        properties.getFile().setPaths(List.of("/in/data.csv", "/archive/data.csv"));

        assertThatThrownBy(() -> new CsvFileExtractor(rateLimiter, properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("data.csv");
    }

    @Test
    void missingFileYieldsNothing() {
        properties.getFile().setPath(dir.resolve("absent.csv").toString());
        CsvFileExtractor extractor = new CsvFileExtractor(rateLimiter, properties);

        assertThat(extractAll(extractor, null)).isEmpty();
    }

    @Test
    void headerOnlyFileYieldsNothing() throws IOException {
        CsvFileExtractor extractor = extractorFor("empty.csv", "id,name\n", StandardCharsets.UTF_8);

        assertThat(extractAll(extractor, null)).isEmpty();
    }

    @Test
    void transformMapsSynonymsCaseInsensitively() throws IOException {
        CsvFileExtractor extractor = extractorFor("items.csv", """
                Name,Summary,Body,By,Type,Link,Tags,Date,Price
                Widget,Small thing,Long text,ann,tools,https://example.com/w,"a, b ,",15/01/2024,9.5
                """, StandardCharsets.UTF_8);
        Map<String, Object> row = extractAll(extractor, null).get(0);

        UnifiedRecord unified = extractor.transform(row);

        assertThat(unified.getTitle()).isEqualTo("Widget");
        assertThat(unified.getDescription()).isEqualTo("Small thing");
        assertThat(unified.getContent()).isEqualTo("Long text");
        assertThat(unified.getAuthor()).isEqualTo("ann");
        assertThat(unified.getCategory()).isEqualTo("tools");
        assertThat(unified.getUrl()).isEqualTo("https://example.com/w");
        assertThat(unified.getTags()).containsExactly("a", "b");
        assertThat(unified.getPublishedAt()).isEqualTo(LocalDateTime.of(2024, 1, 15, 0, 0));
        assertThat(unified.getExtraData()).containsOnlyKeys("Price");
    }

    @Test
    void transformOfMappedColumnsOnlyLeavesNoExtra() {
        CsvFileExtractor extractor = new CsvFileExtractor(rateLimiter, properties);

        UnifiedRecord unified = extractor.transform(Map.of(
                "name", "Widget", "summary", "Small", CsvFileExtractor.ROW_NUMBER, 1L));

        assertThat(unified.getTitle()).isEqualTo("Widget");
        assertThat(unified.getDescription()).isEqualTo("Small");
        assertThat(unified.getExtraData()).isEmpty();
        assertThat(unified.getTags()).isEmpty();
    }

    @Test
    void transformToleratesEmptyRow() {
        UnifiedRecord unified = new CsvFileExtractor(rateLimiter, properties).transform(Map.of());

        assertThat(unified.getTitle()).isNull();
        assertThat(unified.getPublishedAt()).isNull();
        assertThat(unified.getExtraData()).isEmpty();
    }

    @Test
    void everyDateShapeResolvesToTheSameDay() {
        for (String value : List.of("2024-01-15", "15/01/2024", "01/15/2024", "2024/01/15")) {
            assertThat(CsvFileExtractor.publishedAt(Map.of("date", value)))
                    .as(value)
                    .isEqualTo(LocalDateTime.of(2024, 1, 15, 0, 0));
        }
        assertThat(CsvFileExtractor.publishedAt(Map.of("date", "soon", "created_at", "2024-01-15 08:30:00")))
                .isEqualTo(LocalDateTime.of(2024, 1, 15, 8, 30));
    }

    @Test
    void rawPayloadDropsMetadataButChecksumCoversIt() throws IOException {
        CsvFileExtractor extractor = extractorFor("data.csv", "id,name\n1,a\n", StandardCharsets.UTF_8);
        Map<String, Object> row = extractAll(extractor, null).get(0);

        RawRecord raw = extractor.toRawRecord(row, extractor.sourceId(row));

        assertThat(raw.getPayload()).containsOnlyKeys("id", "name");
        assertThat(raw.getSourceRef()).isEqualTo("data.csv");
        assertThat(raw.getChecksum()).isEqualTo(Checksums.sha256(row)).hasSize(64);
    }

    private CsvFileExtractor extractorFor(String name, String content, Charset charset) throws IOException {
        Path file = dir.resolve(name);
        Files.write(file, content.getBytes(charset));
        properties.getFile().setPath(file.toString());
        return new CsvFileExtractor(rateLimiter, properties);
    }

    private static Checkpoint offsets(Map<String, Object> offsets) {
        return Checkpoint.builder()
                .sourceType(SourceType.FILE)
                .metadata(Map.of(ExtractionContext.OFFSETS, offsets))
                .build();
    }

    private static List<Map<String, Object>> extractAll(CsvFileExtractor extractor, Checkpoint checkpoint) {
        try (Stream<Map<String, Object>> stream =
                     extractor.extract(new ExtractionContext("run", checkpoint, new RunCounters()))) {
            return stream.collect(Collectors.toList());
        }
    }
}
