package com.inventorysense.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AlertReport(
    @JsonProperty("summary") AlertSummary summary,
    @JsonProperty("alerts") List<Alert> alerts
) {}
