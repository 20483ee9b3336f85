package com.inventorysense.engine.overview;

import com.inventorysense.common.AnalyticsConfig;
import com.inventorysense.engine.model.DistributorQuarterAggregate;
import com.inventorysense.engine.model.DistributorRisk;
import com.inventorysense.engine.model.OverviewFilter;
import com.inventorysense.engine.model.RawRecord;
import com.inventorysense.engine.model.RiskOverview;
import com.inventorysense.engine.model.StateWaste;
import com.inventorysense.engine.util.Numbers;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Global risk summary: waste by state, riskiest distributors and key insights.
 * Only year and month filters apply here.
 */
public class RiskOverviewEngine {

    static final double HIGH_RISK_PCT = 80;
    static final double RISK_PCT = 60;

    private final int topStates;
    private final int topDistributors;

    private record DistributorStateKey(int distributorId, String state) {}

    private static final Comparator<DistributorStateKey> KEY_ORDER =
        Comparator.comparingInt(DistributorStateKey::distributorId).thenComparing(DistributorStateKey::state);

    private static final class RiskTotals {
        double waste;
        double pctSum;
        int pctCount;
    }

    public RiskOverviewEngine() {
        this(AnalyticsConfig.getOverviewTopStates(), AnalyticsConfig.getOverviewTopDistributors());
    }

    public RiskOverviewEngine(int topStates, int topDistributors) {
        this.topStates = topStates;
        this.topDistributors = topDistributors;
    }

    public RiskOverview overview(List<RawRecord> records, List<DistributorQuarterAggregate> table, OverviewFilter filter) {
        List<RawRecord> filtered = records.stream()
            .filter(record -> filter.matches(record.timeKey()))
            .toList();

        // State-wise waste
        Map<String, Double> wasteByState = new TreeMap<>();
        double totalWaste = 0;
        for (RawRecord record : filtered) {
            totalWaste = Numbers.addSkippingMissing(totalWaste, record.waste());
            if (record.state() != null) {
                wasteByState.merge(record.state(), record.waste() != null ? record.waste() : 0.0, Double::sum);
            }
        }
        List<Map.Entry<String, Double>> topStateEntries = wasteByState.entrySet().stream()
            .sorted(Map.Entry.<String, Double>comparingByValue().reversed())
            .limit(topStates)
            .toList();
        List<StateWaste> stateWise = topStateEntries.stream()
            .map(entry -> new StateWaste(entry.getKey(), Numbers.round(entry.getValue(), 2)))
            .toList();

        // Distributor risk, year filter only
        List<DistributorQuarterAggregate> yearRows = table.stream()
            .filter(row -> filter.matchesYear(row.year()))
            .toList();
        Map<DistributorStateKey, RiskTotals> risks = new TreeMap<>(KEY_ORDER);
        for (DistributorQuarterAggregate row : yearRows) {
            RiskTotals totals = risks.computeIfAbsent(new DistributorStateKey(row.distributorId(), row.state()), k -> new RiskTotals());
            totals.waste += row.totalWaste();
            if (row.pctFromLimit() != null) {
                totals.pctSum += row.pctFromLimit();
                totals.pctCount++;
            }
        }
        List<DistributorRisk> distributorRisks = new ArrayList<>();
        risks.forEach((key, totals) -> {
            if (totals.pctCount == 0) {
                return;
            }
            double average = totals.pctSum / totals.pctCount;
            double riskPct = Numbers.round(Math.max(0, Math.min(100, average)), 1);
            distributorRisks.add(new DistributorRisk(key.distributorId(), key.state(), riskPct, riskLabel(riskPct)));
        });
        List<DistributorRisk> topRisky = distributorRisks.stream()
            .sorted(Comparator.comparingDouble(DistributorRisk::riskPct).reversed())
            .limit(topDistributors)
            .toList();

        return new RiskOverview(stateWise, topRisky, insights(topStateEntries, topRisky, yearRows, totalWaste));
    }

    static String riskLabel(double riskPct) {
        if (riskPct >= HIGH_RISK_PCT) {
            return "High Risk";
        }
        if (riskPct >= RISK_PCT) {
            return "Risk";
        }
        return "OK";
    }

    private List<String> insights(List<Map.Entry<String, Double>> topStateEntries, List<DistributorRisk> topRisky,
                                  List<DistributorQuarterAggregate> yearRows, double totalWaste) {
        List<String> insights = new ArrayList<>();

        if (!topStateEntries.isEmpty() && totalWaste > 0) {
            Map.Entry<String, Double> topState = topStateEntries.get(0);
            double share = topState.getValue() / totalWaste * 100;
            insights.add(topState.getKey() + " accounts for " + Numbers.format(share, 0)
                + "% of total stale inventory losses.");
        }

        Set<Integer> topIds = topRisky.stream()
            .map(DistributorRisk::distributorId)
            .collect(Collectors.toSet());
        double topWaste = yearRows.stream()
            .filter(row -> topIds.contains(row.distributorId()))
            .mapToDouble(DistributorQuarterAggregate::totalWaste)
            .sum();
        double topShare = totalWaste != 0 ? topWaste / totalWaste * 100 : 0;
        insights.add("Top " + topDistributors + " distributors contribute to "
            + Numbers.format(topShare, 0) + "% of total waste.");

        return insights;
    }
}
