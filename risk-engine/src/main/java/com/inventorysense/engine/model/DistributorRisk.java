package com.inventorysense.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Distributor risk on a 0-100 scale for the overview dashboard.
 */
public record DistributorRisk(
    @JsonProperty("distributor_id") int distributorId,
    @JsonProperty("state") String state,
    @JsonProperty("risk_pct") double riskPct,
    @JsonProperty("status") String status
) {}
