package com.inventorysense.engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Presentation badge shown next to a distributor.
 */
public enum StatusBadge {
    EXCEEDED("Exceeded"),
    AT_RISK("At Risk"),
    OK("OK");

    private final String label;

    StatusBadge(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
