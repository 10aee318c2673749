package com.propertyintel.ingest.model;

import java.util.Arrays;

public enum DriftType {

    NEW_FIELD("new_field"),
    MISSING_FIELD("missing_field"),
    TYPE_CHANGE("type_change"),
    RENAMED_FIELD("renamed_field");

    private final String value;

    DriftType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static DriftType fromValue(String value) {
        return Arrays.stream(values())
                .filter(d -> d.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown drift type: " + value));
    }
}
