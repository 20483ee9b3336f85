package com.inventorysense.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Ranked drivers of waste derived from model feature importances.
 */
public record RootCauseReport(
    @JsonProperty("top_factors") List<FactorContribution> topFactors,
    @JsonProperty("primary_cause") Driver primaryCause,
    @JsonProperty("secondary_drivers") List<Driver> secondaryDrivers,
    @JsonProperty("recommended_actions") List<String> recommendedActions
) {
    public record FactorContribution(
        @JsonProperty("feature") String feature,
        @JsonProperty("contribution_pct") double contributionPct
    ) {}

    public record Driver(
        @JsonProperty("feature") String feature,
        @JsonProperty("reason") String reason
    ) {}
}
