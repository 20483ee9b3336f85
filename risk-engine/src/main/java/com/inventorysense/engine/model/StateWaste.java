package com.inventorysense.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StateWaste(
    @JsonProperty("state") String state,
    @JsonProperty("value") double value
) {}
