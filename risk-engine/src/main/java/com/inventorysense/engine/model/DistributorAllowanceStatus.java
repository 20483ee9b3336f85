package com.inventorysense.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Allowance usage of one distributor over the whole dataset.
 */
public record DistributorAllowanceStatus(
    @JsonProperty("distributor_id") int distributorId,
    @JsonProperty("allowance") double allowance,
    @JsonProperty("actual_waste") double actualWaste,
    @JsonProperty("utilization_pct") double utilizationPct,
    @JsonProperty("status") StatusBadge status
) {}
