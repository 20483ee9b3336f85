package com.inventorysense.engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Five-way risk classification of an aggregate row.
 */
public enum RiskStatus {
    HIGH_RISK("High Risk"),
    RISK("Risk"),
    GOOD("Good"),
    VERY_GOOD("Very Good"),
    NOT_CLASSIFIED("Not Classified");

    private final String label;

    RiskStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Collapse to the three-way dashboard badge.
     */
    public StatusBadge toBadge() {
        return switch (this) {
            case HIGH_RISK -> StatusBadge.EXCEEDED;
            case RISK -> StatusBadge.AT_RISK;
            case GOOD, VERY_GOOD, NOT_CLASSIFIED -> StatusBadge.OK;
        };
    }
}
