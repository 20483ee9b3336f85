package com.inventorysense.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Summed metrics of one (distributor, state, year, quarter) key.
 * Rebuilt wholesale whenever the dataset changes.
 */
public record DistributorQuarterAggregate(
    @JsonProperty("distributor_id") int distributorId,
    @JsonProperty("state") String state,
    @JsonProperty("year") int year,
    @JsonProperty("quarter") Quarter quarter,
    @JsonProperty("total_deliveries") double totalDeliveries,
    @JsonProperty("total_returns") double totalReturns,
    @JsonProperty("total_waste_allowance") double totalWasteAllowance,
    @JsonProperty("total_waste") double totalWaste,
    @JsonProperty("pct_from_limit") Double pctFromLimit,
    @JsonProperty("pct_change_from_prior_quarter") Double pctChangeFromPriorQuarter,
    @JsonProperty("status") RiskStatus status
) {
    @JsonIgnore
    public YearQuarter yearQuarter() {
        return new YearQuarter(year, quarter);
    }

    /**
     * Copy with the quarter-over-quarter change and the resulting status set.
     */
    public DistributorQuarterAggregate withTrend(Double pctChange, RiskStatus newStatus) {
        return new DistributorQuarterAggregate(
            distributorId, state, year, quarter,
            totalDeliveries, totalReturns, totalWasteAllowance, totalWaste,
            pctFromLimit, pctChange, newStatus
        );
    }
}
