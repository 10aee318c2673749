package com.propertyintel.ingest.extract;

import com.propertyintel.ingest.model.Checkpoint;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What an extractor may see of the run it is feeding: the checkpoint read at run
 * start and the counters for records it drops or fails to parse on its own.
 */
public final class ExtractionContext {

    public static final String OFFSETS = "offsets";

    private final String runId;
    private final Checkpoint checkpoint;
    private final RunCounters counters;

    public ExtractionContext(String runId, Checkpoint checkpoint, RunCounters counters) {
        this.runId = runId;
        this.checkpoint = checkpoint;
        this.counters = counters;
    }

    public String runId() {
        return runId;
    }

    /** Null when the source type has never been checkpointed. */
    public Checkpoint checkpoint() {
        return checkpoint;
    }

    public String lastSourceId() {
        return checkpoint != null ? checkpoint.getLastSourceId() : null;
    }

    /**
     * Stored offset for one stream of the source, 0 when that stream was never
     * checkpointed. Offsets live in the checkpoint metadata under {@value #OFFSETS}.
     */
    public long lastOffset(String progressKey) {
        Object offsets = storedOffsets(checkpoint).get(progressKey);
        return offsets instanceof Number ? ((Number) offsets).longValue() : 0L;
    }

    static Map<String, Object> storedOffsets(Checkpoint checkpoint) {
        Map<String, Object> offsets = new LinkedHashMap<>();
        if (checkpoint == null || checkpoint.getMetadata() == null) {
            return offsets;
        }
        Object stored = checkpoint.getMetadata().get(OFFSETS);
        if (stored instanceof Map<?, ?>) {
            ((Map<?, ?>) stored).forEach((k, v) -> offsets.put(String.valueOf(k), v));
        }
        return offsets;
    }

    public void reportSkipped() {
        counters.countSkipped();
    }

    public void reportFailed() {
        counters.countFailed();
    }
}
