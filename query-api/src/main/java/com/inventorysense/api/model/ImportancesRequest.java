package com.inventorysense.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.inventorysense.engine.model.FeatureImportance;

import java.util.List;

/**
 * Feature importances published by the model-training subsystem.
 */
public record ImportancesRequest(
    @JsonProperty("model") String model,
    @JsonProperty("importances") List<FeatureImportance> importances
) {}
