package com.inventorysense.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Side-by-side comparison of two quarters within one state.
 */
public record QuarterComparison(
    @JsonProperty("state") String state,
    @JsonProperty("quarter_a") YearQuarter quarterA,
    @JsonProperty("quarter_b") YearQuarter quarterB,
    @JsonProperty("comparison") List<ComparisonRow> comparison
) {}
