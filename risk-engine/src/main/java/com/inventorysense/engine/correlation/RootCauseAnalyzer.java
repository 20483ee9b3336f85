package com.inventorysense.engine.correlation;

import com.inventorysense.common.AnalyticsConfig;
import com.inventorysense.engine.errors.InsufficientDataException;
import com.inventorysense.engine.model.FeatureImportance;
import com.inventorysense.engine.model.RootCauseReport;
import com.inventorysense.engine.model.RootCauseReport.Driver;
import com.inventorysense.engine.model.RootCauseReport.FactorContribution;
import com.inventorysense.engine.util.Numbers;

import java.util.Comparator;
import java.util.List;

/**
 * Turns model feature importances into a root-cause report.
 * Importances are renormalized to percentages summing to 100.
 */
public class RootCauseAnalyzer {

    static final String PRIMARY_REASON = "Primary driver based on highest model contribution";
    static final String SECONDARY_REASON = "Secondary contributor to inventory loss";

    static final List<String> RECOMMENDED_ACTIONS = List.of(
        "Improve return handling for top-risk distributors",
        "Optimize delivery quantities using demand signals",
        "Reduce storage duration for slow-moving inventory"
    );

    private final int topFactors;

    public RootCauseAnalyzer() {
        this(AnalyticsConfig.getRootCauseTopFactors());
    }

    public RootCauseAnalyzer(int topFactors) {
        this.topFactors = topFactors;
    }

    /**
     * @throws InsufficientDataException if no importances are available or they sum to zero
     */
    public RootCauseReport analyze(List<FeatureImportance> importances) {
        if (importances == null || importances.isEmpty()) {
            throw new InsufficientDataException("Feature importance data not available");
        }
        double total = importances.stream().mapToDouble(FeatureImportance::importance).sum();
        if (!(total > 0)) {
            throw new InsufficientDataException("Feature importances sum to " + total + ", cannot normalize");
        }

        List<FactorContribution> factors = importances.stream()
            .sorted(Comparator.comparingDouble(FeatureImportance::importance).reversed())
            .limit(topFactors)
            .map(f -> new FactorContribution(f.feature(), Numbers.round(f.importance() / total * 100, 2)))
            .toList();

        Driver primary = new Driver(factors.get(0).feature(), PRIMARY_REASON);
        List<Driver> secondary = factors.stream()
            .skip(1)
            .limit(2)
            .map(f -> new Driver(f.feature(), SECONDARY_REASON))
            .toList();

        return new RootCauseReport(factors, primary, secondary, RECOMMENDED_ACTIONS);
    }
}
