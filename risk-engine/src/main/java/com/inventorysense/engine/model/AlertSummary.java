package com.inventorysense.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Distinct distributors per severity, counted before deduplication.
 */
public record AlertSummary(
    @JsonProperty("high") long high,
    @JsonProperty("medium") long medium,
    @JsonProperty("low") long low
) {
    public long count(Severity severity) {
        return switch (severity) {
            case HIGH -> high;
            case MEDIUM -> medium;
            case LOW -> low;
        };
    }
}
