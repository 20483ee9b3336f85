package com.inventorysense.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Correlation between two numeric features.
 */
public record Relationship(
    @JsonProperty("f1") String f1,
    @JsonProperty("f2") String f2,
    @JsonProperty("value") double value,
    @JsonProperty("abs") double abs
) {
    public static Relationship of(String f1, String f2, double value) {
        return new Relationship(f1, f2, value, Math.abs(value));
    }
}
