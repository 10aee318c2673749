package com.propertyintel.ingest.exception;

/**
 * Cursor read/write failed. Never swallowed: it means the store is unreachable or corrupt.
 */
public class CheckpointException extends IngestException {

    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
