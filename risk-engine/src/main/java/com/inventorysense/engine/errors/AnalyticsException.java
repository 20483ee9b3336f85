package com.inventorysense.engine.errors;

/**
 * Base type for failures of a single analytics computation.
 * A failure never affects the dataset snapshot the computation was reading.
 */
public class AnalyticsException extends RuntimeException {

    public AnalyticsException(String message) {
        super(message);
    }

    public AnalyticsException(String message, Throwable cause) {
        super(message, cause);
    }
}
