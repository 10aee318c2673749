package com.propertyintel.ingest.extract;

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import com.propertyintel.ingest.config.IngestProperties;
import com.propertyintel.ingest.exception.ExtractionException;
import com.propertyintel.ingest.model.RawRecord;
import com.propertyintel.ingest.model.SourceType;
import com.propertyintel.ingest.model.UnifiedRecord;
import com.propertyintel.ingest.service.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Rows of one or more delimited text files, read in the configured order.
 *
 * Encoding and delimiter are guessed from the head of each file. The checkpoint
 * keeps a row offset per file name; rows up to it are skipped, so a rerun resumes
 * after the last loaded row of every file and a file never seen before is read
 * from the top. Resumption relies on these offsets alone, not on the id cursor.
 * Cells are normalised (see {@link CellValueNormalizer}) and every row carries
 * {@code _row_number} (from 1) and {@code _source_file}.
 *
 * Row numbers inside source ids are zero padded so that ids sort in row order.
 */
@Component
@Slf4j
public class CsvFileExtractor implements SourceExtractor {

    static final String ROW_NUMBER = "_row_number";
    static final String SOURCE_FILE = "_source_file";

    private static final List<String> DATE_FIELDS =
            List.of("date", "created_at", "timestamp", "published_at", "created_date");
    private static final List<String> TITLE_FIELDS = List.of("title", "name", "headline", "subject");
    private static final List<String> DESCRIPTION_FIELDS = List.of("description", "summary", "desc", "abstract");
    private static final List<String> CONTENT_FIELDS = List.of("content", "body", "text", "message");
    private static final List<String> AUTHOR_FIELDS = List.of("author", "creator", "user", "writer", "by");
    private static final List<String> CATEGORY_FIELDS = List.of("category", "type", "group", "section");
    private static final List<String> URL_FIELDS = List.of("url", "link", "href");

    private static final Set<String> MAPPED_FIELDS = Stream.of(
                    TITLE_FIELDS, DESCRIPTION_FIELDS, CONTENT_FIELDS, AUTHOR_FIELDS,
                    CATEGORY_FIELDS, URL_FIELDS, DATE_FIELDS, List.of("tags"))
            .flatMap(List::stream)
            .collect(Collectors.toUnmodifiableSet());

    private final RateLimiter rateLimiter;
    private final IngestProperties.File settings;
    private final TextEncodingDetector encodingDetector;

    public CsvFileExtractor(RateLimiter rateLimiter, IngestProperties properties) {
        this.rateLimiter = rateLimiter;
        this.settings = properties.getFile();
        this.encodingDetector = new TextEncodingDetector(settings.getEncodings(), settings.getSampleSize());

        Set<String> names = new HashSet<>();
        for (Path path : paths()) {
            if (!names.add(fileName(path))) {
                throw new IllegalArgumentException("CSV file name configured twice: " + fileName(path));
            }
        }
    }

    @Override
    public SourceType sourceType() {
        return SourceType.FILE;
    }

    @Override
    public String sourceRef() {
        return paths().stream().map(CsvFileExtractor::fileName).collect(Collectors.joining(","));
    }

    @Override
    public Stream<Map<String, Object>> extract(ExtractionContext context) {
        FileChain files = new FileChain(paths().iterator(), context);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(files, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(files::close);
    }

    @Override
    public String sourceId(Map<String, Object> raw) {
        Object row = raw.get(ROW_NUMBER);
        Object file = raw.get(SOURCE_FILE);
        long rowNumber = row instanceof Number ? ((Number) row).longValue() : 0L;
        return (file != null ? file : "unknown") + ":" + String.format("%09d", rowNumber);
    }

    /** Metadata fields stay out of the stored payload but count towards the checksum. */
    @Override
    public RawRecord toRawRecord(Map<String, Object> raw, String sourceId) {
        Object file = raw.get(SOURCE_FILE);
        return RawRecord.builder()
                .sourceType(sourceType())
                .sourceId(sourceId)
                .payload(withoutMetadata(raw))
                .checksum(Checksums.sha256(raw))
                .sourceRef(file != null ? file.toString() : sourceRef())
                .build();
    }

    @Override
    public String progressKey(Map<String, Object> raw) {
        Object file = raw.get(SOURCE_FILE);
        return file != null ? file.toString() : null;
    }

    @Override
    public boolean filtersByCheckpoint() {
        return false;
    }

    @Override
    public Long offsetOf(Map<String, Object> raw) {
        Object row = raw.get(ROW_NUMBER);
        return row instanceof Number ? ((Number) row).longValue() : null;
    }

    @Override
    public UnifiedRecord transform(Map<String, Object> raw) {
        Map<String, Object> data = withoutMetadata(raw);
        Map<String, Object> byLowerName = new LinkedHashMap<>();
        data.forEach((k, v) -> byLowerName.putIfAbsent(k.toLowerCase(Locale.ROOT), v));

        Map<String, Object> extra = new LinkedHashMap<>();
        data.forEach((k, v) -> {
            if (!MAPPED_FIELDS.contains(k.toLowerCase(Locale.ROOT))) {
                extra.put(k, v);
            }
        });

        return UnifiedRecord.builder()
                .title(firstText(byLowerName, TITLE_FIELDS))
                .description(firstText(byLowerName, DESCRIPTION_FIELDS))
                .content(firstText(byLowerName, CONTENT_FIELDS))
                .author(firstText(byLowerName, AUTHOR_FIELDS))
                .category(firstText(byLowerName, CATEGORY_FIELDS))
                .tags(tags(byLowerName.get("tags")))
                .url(firstText(byLowerName, URL_FIELDS))
                .publishedAt(publishedAt(byLowerName))
                .extraData(extra)
                .build();
    }

    /** First date-like field that parses in any supported format. */
    static LocalDateTime publishedAt(Map<String, Object> byLowerName) {
        for (String field : DATE_FIELDS) {
            Object value = byLowerName.get(field);
            if (value == null) continue;
            LocalDateTime parsed = DateParsing.parse(value.toString());
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    List<Path> paths() {
        List<String> configured = settings.getPaths().stream()
                .filter(p -> p != null && !p.isBlank())
                .toList();
        if (configured.isEmpty()) {
            configured = List.of(settings.getPath());
        }
        return configured.stream().map(Path::of).toList();
    }

    private static String fileName(Path path) {
        Path name = path.getFileName();
        return name != null ? name.toString() : path.toString();
    }

    /** Reader over one file positioned after the header, or null when there is nothing to read. */
    private RowIterator open(Path path, ExtractionContext context) {
        if (!Files.isRegularFile(path)) {
            log.warn("CSV file not found: {}", path);
            return null;
        }
        rateLimiter.acquire(settings.getRateLimitKey());

        CSVReader reader = null;
        try {
            Charset charset = encodingDetector.detect(path);
            char delimiter = CsvDialectSniffer.sniff(readSample(path, charset));
            log.info("Reading CSV {} with encoding {} and delimiter '{}'",
                    path, charset, delimiter == '\t' ? "\\t" : String.valueOf(delimiter));

            Reader text = Files.newBufferedReader(path, charset);
            reader = new CSVReaderBuilder(text)
                    .withCSVParser(new CSVParserBuilder().withSeparator(delimiter).build())
                    .build();

            String[] header = reader.readNext();
            if (header == null) {
                close(reader);
                return null;
            }
            List<String> columns = new ArrayList<>();
            for (int i = 0; i < header.length; i++) {
                String name = i == 0 ? stripBom(header[i]) : header[i];
                columns.add(name.trim());
            }

            String fileName = fileName(path);
            long lastOffset = context.lastOffset(fileName);
            if (lastOffset > 0) {
                log.info("Resuming {} after row {}", fileName, lastOffset);
            }
            return new RowIterator(reader, columns, context, fileName, lastOffset);

        } catch (IOException | CsvValidationException e) {
            close(reader);
            log.error("Error reading CSV file {}: {}", path, e.getMessage());
            throw new ExtractionException("CSV extraction failed: " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> withoutMetadata(Map<String, Object> raw) {
        Map<String, Object> data = new LinkedHashMap<>();
        raw.forEach((k, v) -> {
            if (!k.startsWith("_")) {
                data.put(k, v);
            }
        });
        return data;
    }

    private static String firstText(Map<String, Object> byLowerName, List<String> synonyms) {
        for (String name : synonyms) {
            Object value = byLowerName.get(name);
            if (value != null) {
                return value.toString();
            }
        }
        return null;
    }

    private static List<String> tags(Object value) {
        if (value == null) {
            return List.of();
        }
        return Arrays.stream(value.toString().split(","))
                .map(String::trim)
                .filter(t -> !t.isEmpty())
                .toList();
    }

    private String readSample(Path path, Charset charset) throws IOException {
        char[] buffer = new char[settings.getSampleSize()];
        try (Reader in = Files.newBufferedReader(path, charset)) {
            int read = in.read(buffer);
            return read <= 0 ? "" : new String(buffer, 0, read);
        }
    }

    private static String stripBom(String cell) {
        return cell.startsWith("\uFEFF") ? cell.substring(1) : cell;
    }

    private static void close(CSVReader reader) {
        if (reader == null) return;
        try {
            reader.close();
        } catch (IOException e) {
            log.warn("Failed to close CSV reader: {}", e.getMessage());
        }
    }

    /**
     * Reads ahead one row so hasNext() can answer. Rows at or before the stored
     * offset and empty lines never leave the iterator.
     */
    private static final class RowIterator implements Iterator<Map<String, Object>> {

        private final CSVReader reader;
        private final List<String> columns;
        private final ExtractionContext context;
        private final String fileName;
        private final long lastOffset;
        private long rowNumber;
        private Map<String, Object> next;
        private boolean exhausted;

        RowIterator(CSVReader reader, List<String> columns, ExtractionContext context, String fileName, long lastOffset) {
            this.reader = reader;
            this.columns = columns;
            this.context = context;
            this.fileName = fileName;
            this.lastOffset = lastOffset;
        }

        void close() {
            CsvFileExtractor.close(reader);
        }

        @Override
        public boolean hasNext() {
            if (next == null && !exhausted) {
                next = readRow();
                exhausted = next == null;
            }
            return next != null;
        }

        @Override
        public Map<String, Object> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Map<String, Object> row = next;
            next = null;
            return row;
        }

        private Map<String, Object> readRow() {
            try {
                String[] cells;
                while ((cells = reader.readNext()) != null) {
                    if (cells.length == 1 && cells[0].isEmpty()) {
                        continue;
                    }
                    rowNumber++;
                    if (rowNumber <= lastOffset) {
                        context.reportSkipped();
                        continue;
                    }
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int i = 0; i < columns.size(); i++) {
                        row.put(columns.get(i), i < cells.length ? CellValueNormalizer.clean(cells[i]) : null);
                    }
                    row.put(ROW_NUMBER, rowNumber);
                    row.put(SOURCE_FILE, fileName);
                    return row;
                }
                return null;
            } catch (IOException | CsvValidationException e) {
                throw new ExtractionException("CSV extraction failed at row " + (rowNumber + 1) + ": " + e.getMessage(), e);
            }
        }
    }

    /** Rows of each configured file in turn. Only the file being read is open. */
    private final class FileChain implements Iterator<Map<String, Object>> {

        private final Iterator<Path> pending;
        private final ExtractionContext context;
        private RowIterator current;

        FileChain(Iterator<Path> pending, ExtractionContext context) {
            this.pending = pending;
            this.context = context;
        }

        @Override
        public boolean hasNext() {
            while (current == null || !current.hasNext()) {
                close();
                if (!pending.hasNext()) {
                    return false;
                }
                current = open(pending.next(), context);
            }
            return true;
        }

        @Override
        public Map<String, Object> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return current.next();
        }

        void close() {
            if (current != null) {
                current.close();
                current = null;
            }
        }
    }
}
