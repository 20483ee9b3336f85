package com.inventorysense.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Relationships bucketed by strength. {@code inverse} holds negative correlations only.
 */
public record KeyRelationships(
    @JsonProperty("strong") List<Relationship> strong,
    @JsonProperty("moderate") List<Relationship> moderate,
    @JsonProperty("inverse") List<Relationship> inverse
) {}
