package com.inventorysense.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Headline inventory KPIs.
 */
public record InventoryOverview(
    @JsonProperty("total_waste") double totalWaste,
    @JsonProperty("total_allowance") double totalAllowance,
    @JsonProperty("utilization_rate") double utilizationRate,
    @JsonProperty("high_risk_states") int highRiskStates
) {}
