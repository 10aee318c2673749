package com.propertyintel.ingest.extract;

import com.propertyintel.ingest.exception.ExtractionException;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * RSS 2.0 / RSS 1.0 / Atom reading. Elements are matched on local name, so
 * prefixed extensions (content:encoded, dc:creator, dc:date) are picked up
 * whatever prefix the feed declares.
 */
@Slf4j
final class FeedParser {

    private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("EEE, d MMM yyyy HH:mm:ss", Locale.ENGLISH));

    private FeedParser() {
    }

    static Document parse(String xml) {
        try {
            DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
            dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            dbf.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            dbf.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            dbf.setNamespaceAware(true);
            DocumentBuilder builder = dbf.newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new ExtractionException("Feed parsing failed: " + e.getMessage(), e);
        }
    }

    /** RSS items, or Atom entries when the document has no items. Document order. */
    static List<Element> items(Document document) {
        List<Element> items = elements(document.getElementsByTagNameNS("*", "item"));
        if (items.isEmpty()) {
            items = elements(document.getElementsByTagNameNS("*", "entry"));
        }
        return items;
    }

    /**
     * Raw record of one item: guid, title, link, description, content, pubDate,
     * author, categories. The guid falls back to the link, then to a hash of title and link.
     */
    static Map<String, Object> toRecord(Element item) {
        String title = childText(item, "title");
        String link = link(item);
        String description = firstNonNull(childText(item, "description"), childText(item, "summary"));
        String content = firstNonNull(childText(item, "encoded"), childText(item, "content"));
        String pubDate = firstNonNull(childText(item, "pubDate"), childText(item, "published"),
                childText(item, "updated"), childText(item, "date"));
        String guid = firstNonNull(childText(item, "guid"), childText(item, "id"));
        String author = author(item);

        List<String> categories = new ArrayList<>();
        for (Element category : children(item, "category")) {
            String value = text(category);
            if (value == null && category.hasAttribute("term")) {
                value = category.getAttribute("term").trim();
            }
            if (value != null && !value.isEmpty()) {
                categories.add(value);
            }
        }

        if (guid == null) {
            if (link != null) {
                guid = link;
            } else {
                Map<String, Object> identity = new LinkedHashMap<>();
                identity.put("title", title);
                identity.put("link", link);
                guid = Checksums.sha256(identity);
            }
        }

        Map<String, Object> record = new LinkedHashMap<>();
        record.put("guid", guid);
        record.put("title", title);
        record.put("link", link);
        record.put("description", description);
        record.put("content", content);
        record.put("pubDate", pubDate);
        record.put("author", author);
        record.put("categories", categories);
        return record;
    }

    /**
     * RFC 1123 first, then ISO-8601 with offset, then a few offset-less shapes read as UTC.
     *
     * @return UTC time, or null when nothing matches
     */
    static LocalDateTime parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.trim();
        try {
            return ZonedDateTime.parse(text, DateTimeFormatter.RFC_1123_DATE_TIME)
                    .withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } catch (DateTimeParseException ignored) {
            // try ISO
        }
        try {
            return OffsetDateTime.parse(text).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } catch (DateTimeParseException ignored) {
            // try the local shapes
        }
        for (DateTimeFormatter format : LOCAL_FORMATS) {
            try {
                return LocalDateTime.parse(text, format);
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        log.warn("Could not parse date: {}", value);
        return null;
    }

    /** Tags removed, entities decoded, whitespace collapsed. Empty string for null input. */
    static String stripMarkup(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parse(html).text().trim();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private static String link(Element item) {
        for (Element link : children(item, "link")) {
            String href = link.getAttribute("href");
            String rel = link.getAttribute("rel");
            if (!href.isEmpty() && (rel.isEmpty() || "alternate".equals(rel))) {
                return href.trim();
            }
            String text = text(link);
            if (text != null) {
                return text;
            }
        }
        return null;
    }

    private static String author(Element item) {
        for (Element author : children(item, "author")) {
            List<Element> names = children(author, "name");
            String value = names.isEmpty() ? text(author) : text(names.get(0));
            if (value != null) {
                return value;
            }
        }
        return childText(item, "creator");
    }

    private static String childText(Element parent, String localName) {
        for (Element child : children(parent, localName)) {
            String value = text(child);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static List<Element> children(Element parent, String localName) {
        List<Element> out = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && localName.equals(node.getLocalName())) {
                out.add((Element) node);
            }
        }
        return out;
    }

    private static List<Element> elements(NodeList nodes) {
        List<Element> out = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            out.add((Element) nodes.item(i));
        }
        return out;
    }

    private static String text(Element element) {
        String value = element.getTextContent();
        if (value == null) return null;
        value = value.trim();
        return value.isEmpty() ? null : value;
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T value : values) {
            if (value != null) return value;
        }
        return null;
    }
}
