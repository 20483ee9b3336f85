package com.inventorysense.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Importance of one feature as reported by the model-training subsystem.
 */
public record FeatureImportance(
    @JsonProperty("feature") String feature,
    @JsonProperty("importance") double importance
) {}
