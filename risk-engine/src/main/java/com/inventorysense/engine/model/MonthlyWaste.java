package com.inventorysense.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Allowed versus actual waste of one calendar month.
 */
public record MonthlyWaste(
    @JsonProperty("year") int year,
    @JsonProperty("month") String month,
    @JsonProperty("allowed") double allowed,
    @JsonProperty("actual") double actual
) {}
