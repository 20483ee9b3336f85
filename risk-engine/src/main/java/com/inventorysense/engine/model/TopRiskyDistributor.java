package com.inventorysense.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TopRiskyDistributor(
    @JsonProperty("distributor_id") int distributorId,
    @JsonProperty("state") String state,
    @JsonProperty("quarter") YearQuarter quarter,
    @JsonProperty("risk_pct") double riskPct,
    @JsonProperty("status") RiskStatus status
) {}
