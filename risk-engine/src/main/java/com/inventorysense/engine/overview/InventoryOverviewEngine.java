package com.inventorysense.engine.overview;

import com.inventorysense.common.AnalyticsConfig;
import com.inventorysense.engine.aggregate.RiskClassifier;
import com.inventorysense.engine.model.DistributorAllowanceStatus;
import com.inventorysense.engine.model.InventoryOverview;
import com.inventorysense.engine.model.MonthlyWaste;
import com.inventorysense.engine.model.RawRecord;
import com.inventorysense.engine.model.RiskStatus;
import com.inventorysense.engine.model.TimeKey;
import com.inventorysense.engine.util.Numbers;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Inventory dashboard: headline KPIs, monthly allowed-vs-actual chart and
 * per-distributor allowance usage.
 */
public class InventoryOverviewEngine {

    static final double HIGH_RISK_STATE_USAGE = 80;

    private final int chartMonths;

    private static final class Totals {
        double allowance;
        double waste;
    }

    private record YearMonth(int year, int month) {}

    private static final Comparator<YearMonth> CHRONOLOGICAL =
        Comparator.comparingInt(YearMonth::year).thenComparingInt(YearMonth::month);

    public InventoryOverviewEngine() {
        this(AnalyticsConfig.getChartMonths());
    }

    public InventoryOverviewEngine(int chartMonths) {
        this.chartMonths = chartMonths;
    }

    public InventoryOverview overview(List<RawRecord> records) {
        double totalWaste = 0;
        double totalAllowance = 0;
        Map<String, Totals> byState = new TreeMap<>();
        for (RawRecord record : records) {
            totalWaste = Numbers.addSkippingMissing(totalWaste, record.waste());
            totalAllowance = Numbers.addSkippingMissing(totalAllowance, record.wasteAllowance());
            if (record.state() != null) {
                Totals totals = byState.computeIfAbsent(record.state(), s -> new Totals());
                totals.waste = Numbers.addSkippingMissing(totals.waste, record.waste());
                totals.allowance = Numbers.addSkippingMissing(totals.allowance, record.wasteAllowance());
            }
        }

        double utilization = totalAllowance > 0 ? totalWaste / totalAllowance * 100 : 0;
        int highRiskStates = (int) byState.values().stream()
            .filter(totals -> totals.allowance > 0)
            .filter(totals -> totals.waste / totals.allowance * 100 >= HIGH_RISK_STATE_USAGE)
            .count();

        return new InventoryOverview(
            Numbers.round(totalWaste, 2),
            Numbers.round(totalAllowance, 2),
            Numbers.round(utilization, 1),
            highRiskStates);
    }

    /**
     * Allowed vs actual waste for the most recent months; rows without a time key are skipped.
     */
    public List<MonthlyWaste> monthlyChart(List<RawRecord> records) {
        Map<YearMonth, Totals> byMonth = new TreeMap<>(CHRONOLOGICAL);
        for (RawRecord record : records) {
            TimeKey key = record.timeKey();
            if (key == null) {
                continue;
            }
            Totals totals = byMonth.computeIfAbsent(new YearMonth(key.year(), key.month()), m -> new Totals());
            totals.allowance = Numbers.addSkippingMissing(totals.allowance, record.wasteAllowance());
            totals.waste = Numbers.addSkippingMissing(totals.waste, record.waste());
        }

        List<MonthlyWaste> chart = new ArrayList<>();
        byMonth.forEach((month, totals) -> chart.add(new MonthlyWaste(
            month.year(),
            TimeKey.of(month.year(), month.month()).monthName(),
            Numbers.round(totals.allowance, 2),
            Numbers.round(totals.waste, 2))));
        return List.copyOf(chart.subList(Math.max(0, chart.size() - chartMonths), chart.size()));
    }

    /**
     * Allowance usage per distributor. Missing measures are filled with the column median,
     * and a zero allowance is replaced by the median allowance before dividing.
     */
    public List<DistributorAllowanceStatus> distributorStatus(List<RawRecord> records) {
        Double medianAllowance = median(records, RawRecord::wasteAllowance);
        Double medianWaste = median(records, RawRecord::waste);

        Map<Integer, Totals> byDistributor = new TreeMap<>();
        for (RawRecord record : records) {
            if (record.distributorId() == null) {
                continue;
            }
            Totals totals = byDistributor.computeIfAbsent(record.distributorId(), d -> new Totals());
            totals.allowance = Numbers.addSkippingMissing(totals.allowance,
                record.wasteAllowance() != null ? record.wasteAllowance() : medianAllowance);
            totals.waste = Numbers.addSkippingMissing(totals.waste,
                record.waste() != null ? record.waste() : medianWaste);
        }

        List<DistributorAllowanceStatus> statuses = new ArrayList<>();
        byDistributor.forEach((distributorId, totals) -> {
            Double denominator = totals.allowance != 0 ? Double.valueOf(totals.allowance) : medianAllowance;
            double utilization = 0;
            Double pctFromLimit = null;
            if (denominator != null && denominator != 0) {
                utilization = totals.waste / denominator * 100;
                pctFromLimit = (totals.waste - totals.allowance) / denominator * 100;
            }
            RiskStatus status = RiskClassifier.classify(pctFromLimit, null);
            statuses.add(new DistributorAllowanceStatus(
                distributorId,
                Numbers.round(totals.allowance, 2),
                Numbers.round(totals.waste, 2),
                Numbers.round(utilization, 1),
                status.toBadge()));
        });
        statuses.sort(Comparator.comparingDouble(DistributorAllowanceStatus::utilizationPct).reversed());
        return statuses;
    }

    static Double median(List<RawRecord> records, Function<RawRecord, Double> measure) {
        double[] values = records.stream()
            .map(measure)
            .filter(Objects::nonNull)
            .mapToDouble(Double::doubleValue)
            .sorted()
            .toArray();
        if (values.length == 0) {
            return null;
        }
        int middle = values.length / 2;
        return values.length % 2 == 1 ? values[middle] : (values[middle - 1] + values[middle]) / 2;
    }
}
