package com.propertyintel.ingest.exception;

/**
 * Upstream rejected our credentials. Always fatal for the extractor run.
 */
public class AuthenticationException extends ExtractionException {

    public AuthenticationException(String message) {
        super(message);
    }
}
