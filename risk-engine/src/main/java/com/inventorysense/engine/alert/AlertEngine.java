package com.inventorysense.engine.alert;

import com.inventorysense.engine.model.Alert;
import com.inventorysense.engine.model.AlertFilter;
import com.inventorysense.engine.model.AlertReport;
import com.inventorysense.engine.model.AlertSummary;
import com.inventorysense.engine.model.RawRecord;
import com.inventorysense.engine.model.Severity;
import com.inventorysense.engine.util.Numbers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Derives alerts from raw records grouped by (distributor, state).
 *
 * <p><b>HIGH</b>: waste above allowance (ratio {@literal >} 1.0).
 * <b>MEDIUM</b>: returns above 8% of deliveries.
 * <b>LOW</b>: waste below 60% of allowance.
 * A group whose denominator is zero is skipped by that rule.
 */
public class AlertEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AlertEngine.class);

    static final double WASTE_OVER_ALLOWANCE = 1.0;
    static final double HIGH_RETURN_RATE = 0.08;
    static final double WASTE_WELL_WITHIN = 0.6;

    private static final String TIME_REF = "Recent";

    private record GroupKey(int distributorId, String state) {}

    private static final Comparator<GroupKey> GROUP_ORDER =
        Comparator.comparingInt(GroupKey::distributorId).thenComparing(GroupKey::state);

    private static final class Totals {
        double waste;
        double allowance;
        double returns;
        double deliveries;
    }

    /**
     * Full alert computation: generate, summarize, deduplicate, then filter.
     */
    public AlertReport evaluate(List<RawRecord> records, AlertFilter filter) {
        List<Alert> generated = generate(records);
        AlertSummary summary = summarize(generated);
        List<Alert> alerts = deduplicate(generated).stream()
            .filter(filter::matches)
            .toList();
        LOG.debug("Generated {} alerts, {} after deduplication and filtering", generated.size(), alerts.size());
        return new AlertReport(summary, alerts);
    }

    /**
     * Every rule's alerts in rule order (HIGH, MEDIUM, LOW), groups ordered by distributor and state.
     */
    public List<Alert> generate(List<RawRecord> records) {
        Map<GroupKey, Totals> groups = new TreeMap<>(GROUP_ORDER);
        for (RawRecord record : records) {
            if (!record.isKeyed()) {
                continue;
            }
            Totals totals = groups.computeIfAbsent(new GroupKey(record.distributorId(), record.state()), k -> new Totals());
            totals.waste = Numbers.addSkippingMissing(totals.waste, record.waste());
            totals.allowance = Numbers.addSkippingMissing(totals.allowance, record.wasteAllowance());
            totals.returns = Numbers.addSkippingMissing(totals.returns, record.returns());
            totals.deliveries = Numbers.addSkippingMissing(totals.deliveries, record.deliveries());
        }

        List<Alert> alerts = new ArrayList<>();

        groups.forEach((key, totals) -> {
            if (totals.allowance > 0) {
                double usage = totals.waste / totals.allowance;
                if (usage > WASTE_OVER_ALLOWANCE) {
                    alerts.add(new Alert(Severity.HIGH,
                        "Waste Threshold Exceeded",
                        "Waste exceeded allowance by " + Numbers.format((usage - 1) * 100, 1) + "%",
                        key.distributorId(), key.state(), "Stale Inventory", TIME_REF));
                }
            }
        });

        groups.forEach((key, totals) -> {
            if (totals.deliveries > 0) {
                double returnRate = totals.returns / totals.deliveries;
                if (returnRate > HIGH_RETURN_RATE) {
                    alerts.add(new Alert(Severity.MEDIUM,
                        "High Return Rate",
                        "Returns at " + Numbers.format(returnRate * 100, 1) + "% of deliveries",
                        key.distributorId(), key.state(), "Returns", TIME_REF));
                }
            }
        });

        groups.forEach((key, totals) -> {
            if (totals.allowance > 0 && totals.waste / totals.allowance < WASTE_WELL_WITHIN) {
                alerts.add(new Alert(Severity.LOW,
                    "Good Inventory Control",
                    "Waste well within allowed limits",
                    key.distributorId(), key.state(), "Positive Signal", TIME_REF));
            }
        });

        return alerts;
    }

    /**
     * Count distinct distributors per severity over the non-deduplicated alerts.
     */
    public static AlertSummary summarize(List<Alert> alerts) {
        Map<Severity, Set<Integer>> distributors = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            distributors.put(severity, new HashSet<>());
        }
        alerts.forEach(alert -> distributors.get(alert.severity()).add(alert.distributorId()));
        return new AlertSummary(
            distributors.get(Severity.HIGH).size(),
            distributors.get(Severity.MEDIUM).size(),
            distributors.get(Severity.LOW).size());
    }

    /**
     * Keep one alert per distributor: the highest priority, first encountered on ties.
     */
    public static List<Alert> deduplicate(List<Alert> alerts) {
        List<Alert> byPriority = new ArrayList<>(alerts);
        // List.sort is stable
        byPriority.sort(Comparator.comparingInt((Alert alert) -> alert.severity().priority()).reversed());

        Map<Integer, Alert> kept = new LinkedHashMap<>();
        byPriority.forEach(alert -> kept.putIfAbsent(alert.distributorId(), alert));
        return List.copyOf(kept.values());
    }
}
