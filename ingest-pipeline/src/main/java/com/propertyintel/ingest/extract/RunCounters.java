package com.propertyintel.ingest.extract;

import com.propertyintel.ingest.service.RunTracker;

/**
 * Mutable per-run tallies. A run is driven by one thread, so no synchronisation.
 */
public final class RunCounters {

    private int extracted;
    private int transformed;
    private int loaded;
    private int skipped;
    private int failed;

    void countExtracted() { extracted++; }
    void countTransformed() { transformed++; }
    void countLoaded() { loaded++; }
    void countSkipped() { skipped++; }
    void countFailed() { failed++; }

    public int getExtracted() { return extracted; }
    public int getTransformed() { return transformed; }
    public int getLoaded() { return loaded; }
    public int getSkipped() { return skipped; }
    public int getFailed() { return failed; }

    RunTracker.RunCounts snapshot() {
        return new RunTracker.RunCounts(extracted, transformed, loaded, skipped, failed);
    }
}
