package com.inventorysense.engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of a waste delta between two periods.
 */
public enum TrendDirection {
    UP("up", "⬆️ 🔴"),
    DOWN("down", "⬇️ 🟢"),
    FLAT("flat", "➖");

    private final String label;
    private final String arrow;

    TrendDirection(String label, String arrow) {
        this.label = label;
        this.arrow = arrow;
    }

    public static TrendDirection of(double delta) {
        if (delta > 0) {
            return UP;
        }
        if (delta < 0) {
            return DOWN;
        }
        return FLAT;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Dashboard arrow for this direction.
     */
    public String arrow() {
        return arrow;
    }
}
