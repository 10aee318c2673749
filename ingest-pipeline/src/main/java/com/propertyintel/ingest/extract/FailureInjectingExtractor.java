package com.propertyintel.ingest.extract;

import com.propertyintel.ingest.exception.IngestException;
import com.propertyintel.ingest.model.RawRecord;
import com.propertyintel.ingest.model.SourceType;
import com.propertyintel.ingest.model.UnifiedRecord;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Wraps an extractor so its stream throws when the {@code failAt}-th record is
 * pulled. Records before it are processed normally, which makes the failure a
 * source-level one from the driver's point of view.
 */
public class FailureInjectingExtractor implements SourceExtractor {

    private final SourceExtractor delegate;
    private final int failAt;
    private final AtomicInteger emitted = new AtomicInteger();

    public FailureInjectingExtractor(SourceExtractor delegate, int failAt) {
        if (failAt < 1) {
            throw new IllegalArgumentException("failAt must be at least 1");
        }
        this.delegate = delegate;
        this.failAt = failAt;
    }

    /** Records handed out before the failure fired. */
    public int recordsBeforeFailure() {
        return Math.min(emitted.get(), failAt - 1);
    }

    @Override
    public Stream<Map<String, Object>> extract(ExtractionContext context) {
        return delegate.extract(context).map(record -> {
            int n = emitted.incrementAndGet();
            if (n >= failAt) {
                throw new IngestException("Injected failure at record " + n);
            }
            return record;
        });
    }

    @Override
    public SourceType sourceType() {
        return delegate.sourceType();
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public String sourceId(Map<String, Object> raw) {
        return delegate.sourceId(raw);
    }

    @Override
    public UnifiedRecord transform(Map<String, Object> raw) {
        return delegate.transform(raw);
    }

    @Override
    public String sourceRef() {
        return delegate.sourceRef();
    }

    @Override
    public RawRecord toRawRecord(Map<String, Object> raw, String sourceId) {
        return delegate.toRawRecord(raw, sourceId);
    }

    @Override
    public Long offsetOf(Map<String, Object> raw) {
        return delegate.offsetOf(raw);
    }

    @Override
    public String progressKey(Map<String, Object> raw) {
        return delegate.progressKey(raw);
    }

    @Override
    public boolean filtersByCheckpoint() {
        return delegate.filtersByCheckpoint();
    }

    @Override
    public String checkpointCursor(String firstLoadedId, String lastLoadedId, boolean completed) {
        return delegate.checkpointCursor(firstLoadedId, lastLoadedId, completed);
    }
}
