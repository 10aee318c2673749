package com.propertyintel.ingest.model;

import java.util.Arrays;

public enum RunStatus {

    RUNNING("running"),
    SUCCESS("success"),
    FAILED("failed"),
    PARTIAL("partial");

    private final String value;

    RunStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static RunStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.value.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown run status: " + value));
    }
}
