package com.inventorysense.engine.errors;

/**
 * Raised for a month label that does not match the {@code Mon-YY} format.
 * Tolerated per row by the time normalizer.
 */
public class MonthLabelParseException extends AnalyticsException {

    private final String label;

    public MonthLabelParseException(String label) {
        super("Unparseable month label: '" + label + "'");
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
