package com.propertyintel.ingest.service;

import com.propertyintel.ingest.config.IngestProperties;
import com.propertyintel.ingest.exception.IngestException;
import com.propertyintel.ingest.extract.ExtractionDriver;
import com.propertyintel.ingest.extract.FailureInjectingExtractor;
import com.propertyintel.ingest.extract.SourceExtractor;
import com.propertyintel.ingest.model.ExtractionResult;
import com.propertyintel.ingest.model.OrchestrationSummary;
import com.propertyintel.ingest.model.SourceRunResult;
import com.propertyintel.ingest.model.SourceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the enabled extractors, one after another or on a small pool, and
 * collects one result per source.
 *
 * A failing source becomes a {@code failed} result so the others still run,
 * unless fail-on-error is set; then the first failure is rethrown.
 */
@Service
@Slf4j
public class EtlOrchestrator {

    private final ExtractionDriver driver;
    private final List<SourceExtractor> extractors;
    private final IngestProperties properties;

    public EtlOrchestrator(ExtractionDriver driver, List<SourceExtractor> extractors, IngestProperties properties) {
        this.driver = driver;
        this.extractors = extractors;
        this.properties = properties;
    }

    public OrchestrationSummary runAll() {
        IngestProperties.Orchestrator settings = properties.getOrchestrator();
        return run(enabledExtractors(), settings.isParallel(), settings.isFailOnError());
    }

    public OrchestrationSummary run(List<SourceExtractor> toRun, boolean parallel, boolean failOnError) {
        long start = System.nanoTime();
        log.info("Starting ETL for {} sources ({})", toRun.size(), parallel ? "parallel" : "sequential");

        List<SourceRunResult> results = parallel
                ? runParallel(toRun, failOnError)
                : runSequential(toRun, failOnError);

        OrchestrationSummary summary = OrchestrationSummary.of((System.nanoTime() - start) / 1_000_000_000.0, results);
        log.info("ETL finished in {}s: {} successful, {} failed",
                String.format("%.2f", summary.totalDurationSeconds()), summary.successful(), summary.failed());
        return summary;
    }

    /** One source, regardless of whether it is enabled. */
    public SourceRunResult runSource(SourceType sourceType) {
        SourceExtractor extractor = extractor(sourceType)
                .orElseThrow(() -> new IllegalArgumentException("No extractor for " + sourceType.value()));
        return runOne(extractor, properties.getOrchestrator().isFailOnError());
    }

    /**
     * Runs one source with a forced source-level failure when the {@code failAt}-th
     * record is pulled. Records before it are loaded and checkpointed.
     */
    public SourceRunResult runWithFailureInjection(SourceType sourceType, int failAt) {
        SourceExtractor target = extractor(sourceType)
                .orElseThrow(() -> new IllegalArgumentException("No extractor for " + sourceType.value()));
        FailureInjectingExtractor injected = new FailureInjectingExtractor(target, failAt);
        try {
            ExtractionResult result = driver.run(injected);
            log.warn("Failure injection at {} did not fire for {}: stream ended first", failAt, target.name());
            return SourceRunResult.completed(target.name(), result);
        } catch (RuntimeException e) {
            log.info("Injected failure for {} after {} records", target.name(), injected.recordsBeforeFailure());
            return new SourceRunResult(sourceType, target.name(), SourceRunResult.STATUS_FAILED_INJECTION,
                    null, e.getMessage(), injected.recordsBeforeFailure());
        }
    }

    public Optional<SourceExtractor> extractor(SourceType sourceType) {
        return extractors.stream().filter(e -> e.sourceType() == sourceType).findFirst();
    }

    List<SourceExtractor> enabledExtractors() {
        return extractors.stream().filter(e -> isEnabled(e.sourceType())).toList();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private boolean isEnabled(SourceType sourceType) {
        return switch (sourceType) {
            case API -> properties.getApi().isEnabled();
            case FILE -> properties.getFile().isEnabled();
            case FEED -> properties.getFeed().isEnabled();
        };
    }

    private List<SourceRunResult> runSequential(List<SourceExtractor> toRun, boolean failOnError) {
        List<SourceRunResult> results = new ArrayList<>();
        for (SourceExtractor extractor : toRun) {
            results.add(runOne(extractor, failOnError));
        }
        return results;
    }

    private List<SourceRunResult> runParallel(List<SourceExtractor> toRun, boolean failOnError) {
        List<SourceRunResult> results = new ArrayList<>();
        if (toRun.isEmpty()) {
            return results;
        }
        int poolSize = Math.max(1, Math.min(properties.getOrchestrator().getMaxWorkers(), toRun.size()));
        ExecutorService pool = Executors.newFixedThreadPool(poolSize);
        CompletionService<SourceRunResult> completion = new ExecutorCompletionService<>(pool);
        try {
            for (SourceExtractor extractor : toRun) {
                completion.submit(() -> runOne(extractor, failOnError));
            }
            for (int i = 0; i < toRun.size(); i++) {
                Future<SourceRunResult> future = completion.take();
                try {
                    results.add(future.get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    pool.shutdownNow();
                    if (cause instanceof RuntimeException) {
                        throw (RuntimeException) cause;
                    }
                    throw new IngestException("Extractor failed: " + cause.getMessage(), cause);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IngestException("Interrupted while waiting for extractors", e);
        } finally {
            pool.shutdown();
        }
        return results;
    }

    private SourceRunResult runOne(SourceExtractor extractor, boolean failOnError) {
        log.info("Running {}", extractor.name());
        try {
            return SourceRunResult.completed(extractor.name(), driver.run(extractor));
        } catch (RuntimeException e) {
            if (failOnError) {
                throw e;
            }
            log.error("{} failed: {}", extractor.name(), e.getMessage());
            return SourceRunResult.failed(extractor.sourceType(), extractor.name(), e);
        }
    }
}
