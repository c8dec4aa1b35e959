package com.rfpanalytics.infrastructure.source;

/**
 * An upstream feed could not be read.
 */
public class SourceFetchException extends RuntimeException {

    public SourceFetchException(String message) {
        super(message);
    }

    public SourceFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
