package com.inventorysense.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One quarter of a distributor's waste trend. {@code pctChange} is null for the first quarter.
 */
public record TrendPoint(
    @JsonProperty("quarter") YearQuarter quarter,
    @JsonProperty("state") String state,
    @JsonProperty("waste") double waste,
    @JsonProperty("pct_change") Double pctChange,
    @JsonProperty("status") RiskStatus status
) {}
