package com.inventorysense.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Waste of one distributor in two quarters.
 * A {@code null} waste means the distributor had no row in that quarter,
 * which is distinct from a recorded waste of zero.
 */
public record ComparisonRow(
    @JsonProperty("distributor_id") int distributorId,
    @JsonProperty("total_waste_q1") Double totalWasteQ1,
    @JsonProperty("total_waste_q2") Double totalWasteQ2,
    @JsonProperty("delta") double delta,
    @JsonProperty("trend") TrendDirection trend,
    @JsonProperty("status_change") String statusChange
) {
    @JsonProperty("trend_arrow")
    public String trendArrow() {
        return trend.arrow();
    }
}
