package com.propertyintel.ingest.exception;

/**
 * Base of every pipeline failure. Unchecked so it can escape the lazy record streams.
 */
public class IngestException extends RuntimeException {

    public IngestException(String message) {
        super(message);
    }

    public IngestException(String message, Throwable cause) {
        super(message, cause);
    }
}
