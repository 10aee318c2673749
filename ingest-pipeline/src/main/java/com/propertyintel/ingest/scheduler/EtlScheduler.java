package com.propertyintel.ingest.scheduler;

import com.propertyintel.ingest.config.IngestProperties;
import com.propertyintel.ingest.model.OrchestrationSummary;
import com.propertyintel.ingest.model.SourceRunResult;
import com.propertyintel.ingest.model.SourceType;
import com.propertyintel.ingest.output.SchemaInitializer;
import com.propertyintel.ingest.service.EtlOrchestrator;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Startup, scheduled and manual ETL passes.
 *
 * Only one pass runs at a time: a trigger that arrives while another pass is in
 * flight is dropped, so a source never has two writers.
 *
 * Default schedule: every 5 minutes, UTC. Override with ingest.scheduling.cron.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EtlScheduler {

    private final EtlOrchestrator orchestrator;
    private final SchemaInitializer schemaInitializer;
    private final IngestProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * On application startup:
     *  1. Always ensure the database schema exists
     *  2. Optionally run every enabled source once
     */
    @PostConstruct
    public void onStartup() {
        schemaInitializer.ensureSchema();

        if (properties.getScheduling().isRunOnStartup()) {
            log.info("run-on-startup=true, running all sources");
            runAll();
        } else {
            log.info("Ingest ready. Schedule: {}", properties.getScheduling().getCron());
        }
    }

    @Scheduled(cron = "${ingest.scheduling.cron:0 */5 * * * *}", zone = "UTC")
    public void scheduledRun() {
        log.info("Scheduled ETL triggered");
        runAll();
    }

    /** @return the summary, or empty when another pass was already running or the pass threw */
    public Optional<OrchestrationSummary> runAll() {
        if (!running.compareAndSet(false, true)) {
            log.warn("ETL pass already in progress, skipping");
            return Optional.empty();
        }
        try {
            return runAllClaimed();
        } finally {
            running.set(false);
        }
    }

    public Optional<SourceRunResult> runSource(SourceType sourceType) {
        if (!running.compareAndSet(false, true)) {
            log.warn("ETL pass already in progress, skipping {}", sourceType.value());
            return Optional.empty();
        }
        try {
            return runSourceClaimed(sourceType);
        } finally {
            running.set(false);
        }
    }

    /**
     * Claims the pass on the caller's thread and runs it in the background.
     *
     * @return false when another pass holds the claim; nothing is started then
     */
    public boolean triggerAll() {
        return trigger("manual-etl-all", this::runAllClaimed);
    }

    public boolean triggerSource(SourceType sourceType) {
        return trigger("manual-etl-" + sourceType.value(), () -> runSourceClaimed(sourceType));
    }

    public boolean isRunning() {
        return running.get();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private boolean trigger(String threadName, Runnable pass) {
        if (!running.compareAndSet(false, true)) {
            log.warn("ETL pass already in progress, not starting {}", threadName);
            return false;
        }
        Thread worker = new Thread(() -> {
            try {
                pass.run();
            } finally {
                running.set(false);
            }
        }, threadName);
        try {
            worker.start();
        } catch (RuntimeException e) {
            running.set(false);
            throw e;
        }
        return true;
    }

    private Optional<OrchestrationSummary> runAllClaimed() {
        try {
            return Optional.of(orchestrator.runAll());
        } catch (RuntimeException e) {
            log.error("ETL pass failed: {}", e.getMessage(), e);
            return Optional.empty();
        }
    }

    private Optional<SourceRunResult> runSourceClaimed(SourceType sourceType) {
        try {
            return Optional.of(orchestrator.runSource(sourceType));
        } catch (RuntimeException e) {
            log.error("ETL run for {} failed: {}", sourceType.value(), e.getMessage(), e);
            return Optional.empty();
        }
    }
}
