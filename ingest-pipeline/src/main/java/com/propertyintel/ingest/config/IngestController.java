package com.propertyintel.ingest.config;

import com.propertyintel.ingest.model.EtlRun;
import com.propertyintel.ingest.model.RunStatus;
import com.propertyintel.ingest.model.SourceType;
import com.propertyintel.ingest.scheduler.EtlScheduler;
import com.propertyintel.ingest.service.CheckpointManager;
import com.propertyintel.ingest.service.RunTracker;
import com.propertyintel.ingest.service.SchemaDriftDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class IngestController {

    private final EtlScheduler scheduler;
    private final RunTracker runTracker;
    private final CheckpointManager checkpointManager;
    private final SchemaDriftDetector driftDetector;

    // ── ETL triggers ─────────────────────────────────────────────────────────

    @PostMapping("/etl/trigger")
    public ResponseEntity<Map<String, String>> triggerAll() {
        if (!scheduler.triggerAll()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "ETL pass already running"));
        }
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "target", "all"));
    }

    @PostMapping("/etl/trigger/{sourceType}")
    public ResponseEntity<Map<String, String>> triggerSource(@PathVariable String sourceType) {
        SourceType type;
        try {
            type = SourceType.fromValue(sourceType);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        if (!scheduler.triggerSource(type)) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "ETL pass already running"));
        }
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "target", type.value()));
    }

    // ── Runs ─────────────────────────────────────────────────────────────────

    /**
     * GET /etl/runs?source_type=api&status=failed&limit=10&offset=0
     */
    @GetMapping("/etl/runs")
    public ResponseEntity<?> listRuns(
            @RequestParam(name = "source_type", required = false) String sourceType,
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "10") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        try {
            if (limit < 1 || limit > 100 || offset < 0) {
                return ResponseEntity.badRequest().body(Map.of("error", "limit must be 1-100 and offset >= 0"));
            }
            List<EtlRun> runs = runTracker.listRuns(
                    sourceType != null ? SourceType.fromValue(sourceType) : null,
                    status != null ? RunStatus.fromValue(status) : null,
                    limit, offset);
            return ResponseEntity.ok(runs);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/etl/runs/{runId}")
    public ResponseEntity<?> getRun(@PathVariable String runId) {
        return runTracker.findRun(runId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Run not found")));
    }

    @GetMapping("/etl/compare-runs")
    public ResponseEntity<?> compareRuns(@RequestParam("run_id_1") String runId1,
                                         @RequestParam("run_id_2") String runId2) {
        try {
            return ResponseEntity.ok(runTracker.compareRuns(runId1, runId2));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/etl/stats")
    public ResponseEntity<?> stats(@RequestParam(defaultValue = "24") int hours) {
        if (hours < 1 || hours > 720) {
            return ResponseEntity.badRequest().body(Map.of("error", "hours must be 1-720"));
        }
        return ResponseEntity.ok(runTracker.stats(hours));
    }

    // ── Checkpoints ──────────────────────────────────────────────────────────

    @GetMapping("/etl/checkpoints")
    public ResponseEntity<?> checkpoints() {
        return ResponseEntity.ok(checkpointManager.getAllCheckpoints());
    }

    @PostMapping("/etl/checkpoints/{sourceType}/reset")
    public ResponseEntity<?> resetCheckpoint(@PathVariable String sourceType) {
        try {
            SourceType type = SourceType.fromValue(sourceType);
            checkpointManager.resetCheckpoint(type);
            return ResponseEntity.ok(Map.of("status", "reset", "source_type", type.value()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    // ── Schema drift ─────────────────────────────────────────────────────────

    @GetMapping("/etl/schema-drifts")
    public ResponseEntity<?> drifts(@RequestParam(name = "source_type", required = false) String sourceType) {
        try {
            return ResponseEntity.ok(driftDetector.unresolvedDrifts(
                    sourceType != null ? SourceType.fromValue(sourceType) : null));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/etl/schema-drifts/{driftId}/resolve")
    public ResponseEntity<?> resolveDrift(@PathVariable long driftId) {
        if (!driftDetector.resolveDrift(driftId)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Schema drift not found"));
        }
        return ResponseEntity.ok(Map.of("status", "resolved", "drift_id", driftId));
    }

    @GetMapping("/etl/schemas/{sourceType}")
    public ResponseEntity<?> expectedSchema(@PathVariable String sourceType) {
        try {
            return ResponseEntity.ok(driftDetector.expectedSchema(SourceType.fromValue(sourceType)));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PutMapping("/etl/schemas/{sourceType}")
    public ResponseEntity<?> replaceSchema(@PathVariable String sourceType,
                                           @RequestBody Map<String, String> schema) {
        try {
            SourceType type = SourceType.fromValue(sourceType);
            driftDetector.updateExpectedSchema(type, schema);
            return ResponseEntity.ok(driftDetector.expectedSchema(type));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
