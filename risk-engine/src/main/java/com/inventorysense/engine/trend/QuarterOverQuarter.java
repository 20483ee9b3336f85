package com.inventorysense.engine.trend;

import com.inventorysense.engine.model.DistributorQuarterAggregate;
import com.inventorysense.engine.util.Numbers;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Quarter-over-quarter waste change per distributor.
 */
public final class QuarterOverQuarter {

    private QuarterOverQuarter() {
    }

    /**
     * Percent change of total waste against the distributor's previous row.
     * Rows must already be ordered by distributor, year and quarter; distributors are
     * tracked by id only, so one that spans states chains across them.
     *
     * @return one value per input row, {@code null} for a distributor's first row
     *         and wherever the previous waste was zero
     */
    public static List<Double> pctChanges(List<DistributorQuarterAggregate> orderedRows) {
        Map<Integer, Double> previousWaste = new HashMap<>();
        List<Double> changes = new ArrayList<>(orderedRows.size());
        for (DistributorQuarterAggregate row : orderedRows) {
            Double previous = previousWaste.put(row.distributorId(), row.totalWaste());
            changes.add(pctChange(previous, row.totalWaste()));
        }
        return changes;
    }

    static Double pctChange(Double previous, double current) {
        if (previous == null || previous == 0) {
            return null;
        }
        return Numbers.round((current / previous - 1) * 100, 2);
    }
}
