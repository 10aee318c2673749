package com.propertyintel.ingest.model;

import java.time.LocalDateTime;
import java.util.Map;

public record EtlStats(
        long totalRecordsProcessed,
        Map<String, Long> recordsBySource,
        int runsInPeriod,
        double successRate,
        double averageDurationSeconds,
        LocalDateTime lastSuccess,
        LocalDateTime lastFailure,
        int periodHours) {
}
