package com.inventorysense.engine.errors;

/**
 * Raised when the data present cannot support the requested computation,
 * e.g. fewer than two numeric columns for a correlation matrix.
 */
public class InsufficientDataException extends AnalyticsException {

    public InsufficientDataException(String message) {
        super(message);
    }
}
