package com.rfpanalytics.domain.service;

/**
 * A summary could not be computed because a primary source failed. No
 * partial result is ever returned alongside it.
 */
public class SummaryComputationException extends RuntimeException {

    public SummaryComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
