package com.propertyintel.ingest.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.temporal.Temporal;
import java.util.Arrays;
import java.util.Collection;
import java.util.Date;
import java.util.Locale;
import java.util.Map;

/**
 * Closed set of value tags used when comparing a record's shape against
 * an expected schema. Tags are stored as their short names (str, dict, ...).
 */
public enum ValueType {

    NULL("null"),
    BOOL("bool"),
    INT("int"),
    FLOAT("float"),
    STR("str"),
    LIST("list"),
    DICT("dict"),
    DATETIME("datetime"),
    OTHER("other");

    private final String tag;

    ValueType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static ValueType of(Object value) {
        if (value == null) return NULL;
        if (value instanceof Boolean) return BOOL;
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) return INT;
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) return FLOAT;
        if (value instanceof CharSequence || value instanceof Character) return STR;
        if (value instanceof Collection<?> || value.getClass().isArray()) return LIST;
        if (value instanceof Map<?, ?>) return DICT;
        if (value instanceof Temporal || value instanceof Date) return DATETIME;
        return OTHER;
    }

    /**
     * Accepts the short tags plus a few common spellings ("string", "map", "boolean").
     */
    public static ValueType fromTag(String tag) {
        if (tag == null) return OTHER;
        String t = tag.trim().toLowerCase(Locale.ROOT);
        return switch (t) {
            case "string" -> STR;
            case "map", "object" -> DICT;
            case "boolean" -> BOOL;
            case "integer", "long" -> INT;
            case "double", "number", "decimal" -> FLOAT;
            case "array" -> LIST;
            default -> Arrays.stream(values())
                    .filter(v -> v.tag.equals(t))
                    .findFirst()
                    .orElse(OTHER);
        };
    }
}
