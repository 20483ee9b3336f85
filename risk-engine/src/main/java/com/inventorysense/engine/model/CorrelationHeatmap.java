package com.inventorysense.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Pearson correlation matrix aligned to {@code features}.
 * A cell is {@code null} when the coefficient is undefined (constant column, too few paired values).
 */
public record CorrelationHeatmap(
    @JsonProperty("features") List<String> features,
    @JsonProperty("matrix") List<List<Double>> matrix
) {
    public Double value(int i, int j) {
        return matrix.get(i).get(j);
    }
}
