package com.inventorysense.engine.trend;

import com.inventorysense.common.AnalyticsConfig;
import com.inventorysense.engine.errors.DataNotFoundException;
import com.inventorysense.engine.model.ComparisonRow;
import com.inventorysense.engine.model.DistributorQuarterAggregate;
import com.inventorysense.engine.model.DistributorTrend;
import com.inventorysense.engine.model.QuarterComparison;
import com.inventorysense.engine.model.RiskStatus;
import com.inventorysense.engine.model.TopRiskyDistributor;
import com.inventorysense.engine.model.TrendDirection;
import com.inventorysense.engine.model.TrendPoint;
import com.inventorysense.engine.model.YearQuarter;
import com.inventorysense.engine.util.Numbers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Time-based views over the distributor-quarter table: single distributor trend,
 * two-quarter comparison and the top-risky ranking.
 */
public class TrendEngine {

    private static final Logger LOG = LoggerFactory.getLogger(TrendEngine.class);

    static final String UNKNOWN_STATUS = "Unknown";
    private static final String STATUS_ARROW = " → ";

    private final int topRiskyLimit;

    public TrendEngine() {
        this(AnalyticsConfig.getTopRiskyLimit());
    }

    public TrendEngine(int topRiskyLimit) {
        this.topRiskyLimit = topRiskyLimit;
    }

    /**
     * Quarter-by-quarter trend of one distributor across all its states.
     *
     * @throws DataNotFoundException if the distributor has no rows
     */
    public DistributorTrend distributorTrend(List<DistributorQuarterAggregate> table, int distributorId) {
        List<TrendPoint> points = table.stream()
            .filter(row -> row.distributorId() == distributorId)
            .sorted(Comparator.comparing(DistributorQuarterAggregate::yearQuarter))
            .map(row -> new TrendPoint(
                row.yearQuarter(),
                row.state(),
                row.totalWaste(),
                row.pctChangeFromPriorQuarter(),
                row.status()))
            .collect(Collectors.toList());

        if (points.isEmpty()) {
            throw new DataNotFoundException("No data found for distributor " + distributorId);
        }
        return new DistributorTrend(distributorId, points);
    }

    /**
     * Compare one or two distributors between two quarters of a state.
     *
     * @throws DataNotFoundException if the state has no rows
     * @throws IllegalArgumentException if a quarter label is malformed or no distributor is given
     */
    public QuarterComparison compareQuarters(List<DistributorQuarterAggregate> table, String state,
                                             String quarterA, String quarterB, List<Integer> distributorIds) {
        if (distributorIds == null || distributorIds.isEmpty()) {
            throw new IllegalArgumentException("At least one distributor is required");
        }
        YearQuarter periodA = YearQuarter.parse(quarterA);
        YearQuarter periodB = YearQuarter.parse(quarterB);

        List<DistributorQuarterAggregate> stateRows = table.stream()
            .filter(row -> row.state().equals(state))
            .toList();
        if (stateRows.isEmpty()) {
            throw new DataNotFoundException("No data for selected state: " + state);
        }

        List<DistributorQuarterAggregate> rowsA = selectQuarter(stateRows, periodA, distributorIds);

        if (periodA.equals(periodB)) {
            LOG.debug("Same quarter {} requested for both sides, comparing rows to themselves", periodA);
            List<ComparisonRow> self = rowsA.stream()
                .map(row -> new ComparisonRow(
                    row.distributorId(),
                    row.totalWaste(),
                    row.totalWaste(),
                    0.0,
                    TrendDirection.FLAT,
                    row.status().label() + STATUS_ARROW + row.status().label()))
                .toList();
            return new QuarterComparison(state, periodA, periodB, self);
        }

        List<DistributorQuarterAggregate> rowsB = selectQuarter(stateRows, periodB, distributorIds);

        // Outer join on distributor id; the state filter leaves at most one row per side
        Map<Integer, DistributorQuarterAggregate[]> joined = new TreeMap<>();
        rowsA.forEach(row -> joined.computeIfAbsent(row.distributorId(), id -> new DistributorQuarterAggregate[2])[0] = row);
        rowsB.forEach(row -> joined.computeIfAbsent(row.distributorId(), id -> new DistributorQuarterAggregate[2])[1] = row);

        List<ComparisonRow> comparison = new ArrayList<>(joined.size());
        joined.forEach((distributorId, pair) -> comparison.add(compare(distributorId, pair[0], pair[1])));

        LOG.debug("Compared {} distributor(s) in {} between {} and {}", comparison.size(), state, periodA, periodB);
        return new QuarterComparison(state, periodA, periodB, comparison);
    }

    /**
     * Rows with the highest {@code pct_from_limit}; ties keep table order.
     */
    public List<TopRiskyDistributor> topRisky(List<DistributorQuarterAggregate> table) {
        return table.stream()
            .filter(row -> row.pctFromLimit() != null)
            .sorted(Comparator.comparing(DistributorQuarterAggregate::pctFromLimit).reversed())
            .limit(topRiskyLimit)
            .map(row -> new TopRiskyDistributor(
                row.distributorId(),
                row.state(),
                row.yearQuarter(),
                Numbers.round(row.pctFromLimit(), 1),
                row.status()))
            .toList();
    }

    private static List<DistributorQuarterAggregate> selectQuarter(List<DistributorQuarterAggregate> rows,
                                                                   YearQuarter period, List<Integer> distributorIds) {
        return rows.stream()
            .filter(row -> row.yearQuarter().equals(period))
            .filter(row -> distributorIds.contains(row.distributorId()))
            .toList();
    }

    private static ComparisonRow compare(int distributorId, DistributorQuarterAggregate first,
                                         DistributorQuarterAggregate second) {
        Double wasteA = first != null ? first.totalWaste() : null;
        Double wasteB = second != null ? second.totalWaste() : null;
        double delta = Numbers.round((wasteB != null ? wasteB : 0.0) - (wasteA != null ? wasteA : 0.0), 2);
        return new ComparisonRow(
            distributorId,
            wasteA,
            wasteB,
            delta,
            TrendDirection.of(delta),
            statusLabel(first) + STATUS_ARROW + statusLabel(second));
    }

    private static String statusLabel(DistributorQuarterAggregate row) {
        if (row == null) {
            return UNKNOWN_STATUS;
        }
        RiskStatus status = row.status();
        return status != null ? status.label() : UNKNOWN_STATUS;
    }
}
