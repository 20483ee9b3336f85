package com.inventorysense.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A severity-tagged signal for one distributor and state. Derived per request, never stored.
 */
public record Alert(
    @JsonProperty("severity") Severity severity,
    @JsonProperty("title") String title,
    @JsonProperty("description") String description,
    @JsonProperty("distributor_id") int distributorId,
    @JsonProperty("state") String state,
    @JsonProperty("category") String category,
    @JsonProperty("time_ref") String timeRef
) {}
