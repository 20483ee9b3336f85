package com.inventorysense.engine.errors;

/**
 * Raised when a query runs before any dataset has been uploaded.
 */
public class DatasetNotLoadedException extends AnalyticsException {

    public DatasetNotLoadedException() {
        super("Dataset not uploaded yet");
    }
}
