package com.inventorysense.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Quarter-by-quarter waste trend of a single distributor.
 */
public record DistributorTrend(
    @JsonProperty("distributor_id") int distributorId,
    @JsonProperty("trend") List<TrendPoint> trend
) {}
