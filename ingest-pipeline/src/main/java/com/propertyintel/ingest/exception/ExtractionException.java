package com.propertyintel.ingest.exception;

/**
 * Source-level failure: network, parse or file I/O. Aborts the run.
 */
public class ExtractionException extends IngestException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
