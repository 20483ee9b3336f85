package com.inventorysense.engine.errors;

import java.util.List;

/**
 * Raised when the dataset lacks columns a computation requires.
 */
public class SchemaException extends AnalyticsException {

    private final List<String> missingColumns;

    public SchemaException(List<String> missingColumns) {
        super("Missing required columns: " + missingColumns);
        this.missingColumns = List.copyOf(missingColumns);
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
