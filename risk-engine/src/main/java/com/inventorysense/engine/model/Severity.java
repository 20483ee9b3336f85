package com.inventorysense.engine.model;

/**
 * Alert severity. Higher priority wins when alerts are deduplicated per distributor.
 */
public enum Severity {
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    private final int priority;

    Severity(int priority) {
        this.priority = priority;
    }

    public int priority() {
        return priority;
    }
}
