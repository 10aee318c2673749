package com.propertyintel.ingest.model;

import java.util.Arrays;

/**
 * The three ingestion channels. The lower-case value is what gets stored
 * in every table's source_type column.
 */
public enum SourceType {

    API("api"),
    FILE("file"),
    FEED("feed");

    private final String value;

    SourceType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static SourceType fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown source type: " + value));
    }
}
