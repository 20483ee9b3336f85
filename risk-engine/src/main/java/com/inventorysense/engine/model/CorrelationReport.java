package com.inventorysense.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CorrelationReport(
    @JsonProperty("heatmap") CorrelationHeatmap heatmap,
    @JsonProperty("key_relationships") KeyRelationships keyRelationships
) {}
