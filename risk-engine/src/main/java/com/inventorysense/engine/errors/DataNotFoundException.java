package com.inventorysense.engine.errors;

/**
 * Raised when a requested key (distributor, state, quarter) matches no rows.
 */
public class DataNotFoundException extends AnalyticsException {

    public DataNotFoundException(String message) {
        super(message);
    }
}
