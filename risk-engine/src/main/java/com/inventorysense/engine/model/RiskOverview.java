package com.inventorysense.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record RiskOverview(
    @JsonProperty("state_wise_waste") List<StateWaste> stateWiseWaste,
    @JsonProperty("high_risk_distributors") List<DistributorRisk> highRiskDistributors,
    @JsonProperty("key_insights") List<String> keyInsights
) {}
