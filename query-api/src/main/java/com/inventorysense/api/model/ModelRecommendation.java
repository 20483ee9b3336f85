package com.inventorysense.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Fixed, rule-based hint about which features suit a model family.
 */
public record ModelRecommendation(
    @JsonProperty("features") List<String> features,
    @JsonProperty("reason") String reason
) {}
