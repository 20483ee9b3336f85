package com.inventorysense.engine.aggregate;

import com.inventorysense.common.DatasetColumns;
import com.inventorysense.engine.errors.SchemaException;
import com.inventorysense.engine.model.DistributorQuarterAggregate;
import com.inventorysense.engine.model.Quarter;
import com.inventorysense.engine.model.RawRecord;
import com.inventorysense.engine.model.RiskStatus;
import com.inventorysense.engine.trend.QuarterOverQuarter;
import com.inventorysense.engine.util.Numbers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the distributor-quarter table: one row per observed
 * (distributor, state, year, quarter) key with summed measures,
 * limit deviation, quarter-over-quarter change and risk status.
 */
public class DistributorQuarterAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(DistributorQuarterAggregator.class);

    /**
     * Table order: distributor, then time, with state breaking ties.
     */
    public static final Comparator<DistributorQuarterAggregate> TABLE_ORDER =
        Comparator.comparingInt(DistributorQuarterAggregate::distributorId)
            .thenComparingInt(DistributorQuarterAggregate::year)
            .thenComparing(DistributorQuarterAggregate::quarter)
            .thenComparing(DistributorQuarterAggregate::state);

    private record GroupKey(int distributorId, String state, int year, Quarter quarter) {}

    private static final class Totals {
        double deliveries;
        double returns;
        double allowance;
        double waste;

        void add(RawRecord record) {
            deliveries = Numbers.addSkippingMissing(deliveries, record.deliveries());
            returns = Numbers.addSkippingMissing(returns, record.returns());
            allowance = Numbers.addSkippingMissing(allowance, record.wasteAllowance());
            waste = Numbers.addSkippingMissing(waste, record.waste());
        }
    }

    /**
     * Aggregate time-keyed records.
     *
     * @param columns columns of the source dataset, checked once before grouping
     * @param records records already annotated by the time normalizer
     * @throws SchemaException if a required column is absent
     */
    public List<DistributorQuarterAggregate> aggregate(Collection<String> columns, List<RawRecord> records) {
        List<String> missing = DatasetColumns.REQUIRED.stream()
            .filter(column -> !columns.contains(column))
            .toList();
        if (!missing.isEmpty()) {
            throw new SchemaException(missing);
        }

        Map<GroupKey, Totals> groups = new LinkedHashMap<>();
        int dropped = 0;
        for (RawRecord record : records) {
            if (!record.isKeyed() || record.timeKey() == null) {
                dropped++;
                continue;
            }
            GroupKey key = new GroupKey(record.distributorId(), record.state(),
                record.timeKey().year(), record.timeKey().quarter());
            groups.computeIfAbsent(key, k -> new Totals()).add(record);
        }

        List<DistributorQuarterAggregate> rows = new ArrayList<>(groups.size());
        groups.forEach((key, totals) -> {
            double allowance = Numbers.round(totals.allowance, 2);
            double waste = Numbers.round(totals.waste, 2);
            rows.add(new DistributorQuarterAggregate(
                key.distributorId(), key.state(), key.year(), key.quarter(),
                Numbers.round(totals.deliveries, 2),
                Numbers.round(totals.returns, 2),
                allowance,
                waste,
                RiskClassifier.pctFromLimit(waste, allowance),
                null,
                null
            ));
        });
        rows.sort(TABLE_ORDER);

        List<Double> changes = QuarterOverQuarter.pctChanges(rows);
        List<DistributorQuarterAggregate> table = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            DistributorQuarterAggregate row = rows.get(i);
            Double change = changes.get(i);
            RiskStatus status = RiskClassifier.classify(row.pctFromLimit(), change);
            table.add(row.withTrend(change, status));
        }

        LOG.info("Built distributor-quarter table: {} rows from {} records ({} dropped without distributor, state or month)",
            table.size(), records.size(), dropped);
        return List.copyOf(table);
    }
}
