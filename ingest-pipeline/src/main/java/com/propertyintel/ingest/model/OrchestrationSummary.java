package com.propertyintel.ingest.model;

import java.util.List;

/**
 * Aggregate of one orchestrated pass over all enabled sources.
 * Results are listed in completion order.
 */
public record OrchestrationSummary(
        double totalDurationSeconds,
        int sourcesProcessed,
        int successful,
        int failed,
        List<SourceRunResult> results) {

    public static OrchestrationSummary of(double durationSeconds, List<SourceRunResult> results) {
        int successful = (int) results.stream().filter(SourceRunResult::isSuccess).count();
        int failed = (int) results.stream().filter(SourceRunResult::isFailed).count();
        return new OrchestrationSummary(durationSeconds, results.size(), successful, failed, List.copyOf(results));
    }

    public boolean hasFailures() {
        return failed > 0;
    }
}
