package com.propertyintel.ingest.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * JSON (de)serialisation for the TEXT columns holding maps and lists.
 */
@Component
@RequiredArgsConstructor
public class JsonColumns {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<String>> STRING_LIST_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    /** Null and empty containers are stored as SQL NULL. */
    public String write(Object value) {
        if (value == null
                || value instanceof Map<?, ?> && ((Map<?, ?>) value).isEmpty()
                || value instanceof List<?> && ((List<?>) value).isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not JSON serialisable: " + e.getMessage(), e);
        }
    }

    public Map<String, Object> readMap(String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt JSON column: " + e.getMessage(), e);
        }
    }

    public List<String> readStringList(String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return objectMapper.readValue(json, STRING_LIST_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt JSON column: " + e.getMessage(), e);
        }
    }
}
