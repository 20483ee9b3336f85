package com.inventorysense.api.services;

import com.inventorysense.api.model.AnalyticsResult;
import com.inventorysense.api.model.CorrelationAnalysis;
import com.inventorysense.engine.alert.AlertEngine;
import com.inventorysense.engine.context.DatasetContext;
import com.inventorysense.engine.context.DatasetSnapshot;
import com.inventorysense.engine.correlation.CorrelationEngine;
import com.inventorysense.engine.correlation.RootCauseAnalyzer;
import com.inventorysense.engine.model.AlertFilter;
import com.inventorysense.engine.model.AlertReport;
import com.inventorysense.engine.model.DistributorTrend;
import com.inventorysense.engine.model.OverviewFilter;
import com.inventorysense.engine.model.QuarterComparison;
import com.inventorysense.engine.model.RiskOverview;
import com.inventorysense.engine.model.RootCauseReport;
import com.inventorysense.engine.model.TopRiskyDistributor;
import com.inventorysense.engine.overview.RiskOverviewEngine;
import com.inventorysense.engine.trend.TrendEngine;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Risk, alert and correlation queries over the current dataset snapshot.
 * Each call reads the snapshot once and computes everything from that reference.
 */
@ApplicationScoped
public class RiskAnalyticsService {

    private static final Logger LOG = Logger.getLogger(RiskAnalyticsService.class);

    @Inject
    DatasetContext datasetContext;

    @Inject
    TrendEngine trendEngine;

    @Inject
    AlertEngine alertEngine;

    @Inject
    CorrelationEngine correlationEngine;

    @Inject
    RootCauseAnalyzer rootCauseAnalyzer;

    @Inject
    RiskOverviewEngine riskOverviewEngine;

    @Inject
    FeatureImportanceStore importanceStore;

    // ===========================================
    // Risk
    // ===========================================

    public AnalyticsResult<RiskOverview> riskOverview(List<String> years, List<String> months) {
        long startTime = System.currentTimeMillis();
        OverviewFilter filter = OverviewFilter.of(years, months);
        DatasetSnapshot snapshot = datasetContext.current();

        RiskOverview overview = riskOverviewEngine.overview(snapshot.records(), snapshot.distributorQuarters(), filter);

        long queryTime = System.currentTimeMillis() - startTime;
        return AnalyticsResult.of(overview, snapshot.version(), queryTime,
            String.format("%d states, %d distributors ranked", overview.stateWiseWaste().size(),
                overview.highRiskDistributors().size()));
    }

    public AnalyticsResult<DistributorTrend> distributorTrend(int distributorId) {
        long startTime = System.currentTimeMillis();
        DatasetSnapshot snapshot = datasetContext.current();

        DistributorTrend trend = trendEngine.distributorTrend(snapshot.distributorQuarters(), distributorId);

        long queryTime = System.currentTimeMillis() - startTime;
        return AnalyticsResult.of(trend, snapshot.version(), queryTime,
            String.format("%d quarters for distributor %d", trend.trend().size(), distributorId));
    }

    public AnalyticsResult<QuarterComparison> compareQuarters(String state, String quarterA, String quarterB,
                                                              Integer distributor1, Integer distributor2) {
        long startTime = System.currentTimeMillis();
        if (state == null || state.isBlank()) {
            throw new IllegalArgumentException("state is required");
        }
        if (distributor1 == null) {
            throw new IllegalArgumentException("distributor_1 is required");
        }
        List<Integer> distributorIds = new ArrayList<>();
        distributorIds.add(distributor1);
        if (distributor2 != null) {
            distributorIds.add(distributor2);
        }
        DatasetSnapshot snapshot = datasetContext.current();

        QuarterComparison comparison = trendEngine.compareQuarters(
            snapshot.distributorQuarters(), state, quarterA, quarterB, distributorIds);

        long queryTime = System.currentTimeMillis() - startTime;
        return AnalyticsResult.of(comparison, snapshot.version(), queryTime,
            String.format("%s vs %s in %s", comparison.quarterA(), comparison.quarterB(), state));
    }

    public AnalyticsResult<List<TopRiskyDistributor>> topRisky() {
        long startTime = System.currentTimeMillis();
        DatasetSnapshot snapshot = datasetContext.current();

        List<TopRiskyDistributor> top = trendEngine.topRisky(snapshot.distributorQuarters());

        long queryTime = System.currentTimeMillis() - startTime;
        return AnalyticsResult.of(top, snapshot.version(), queryTime,
            String.format("Top %d distributor-quarters by percent from limit", top.size()));
    }

    // ===========================================
    // Alerts
    // ===========================================

    public AnalyticsResult<AlertReport> alerts(String severity, String distributor, String state) {
        long startTime = System.currentTimeMillis();
        AlertFilter filter = AlertFilter.of(severity, distributor, state);
        DatasetSnapshot snapshot = datasetContext.current();

        AlertReport report = alertEngine.evaluate(snapshot.records(), filter);

        long queryTime = System.currentTimeMillis() - startTime;
        LOG.debugf("Alert query %s returned %d alerts in %dms", filter, report.alerts().size(), queryTime);
        return AnalyticsResult.of(report, snapshot.version(), queryTime,
            String.format("%d high, %d medium, %d low", report.summary().high(),
                report.summary().medium(), report.summary().low()));
    }

    // ===========================================
    // Correlation and root cause
    // ===========================================

    public AnalyticsResult<CorrelationAnalysis> correlation() {
        long startTime = System.currentTimeMillis();
        DatasetSnapshot snapshot = datasetContext.current();

        CorrelationAnalysis analysis = CorrelationAnalysis.of(correlationEngine.analyze(snapshot.dataset()));

        long queryTime = System.currentTimeMillis() - startTime;
        return AnalyticsResult.of(analysis, snapshot.version(), queryTime,
            String.format("Correlation over %d numeric features", analysis.heatmap().features().size()));
    }

    /**
     * Root-cause report from the latest published importances; independent of the dataset snapshot.
     */
    public AnalyticsResult<RootCauseReport> rootCause() {
        long startTime = System.currentTimeMillis();
        FeatureImportanceStore.Published published = importanceStore.current();

        RootCauseReport report = rootCauseAnalyzer.analyze(published.importances());

        long queryTime = System.currentTimeMillis() - startTime;
        long datasetVersion = datasetContext.peek().map(DatasetSnapshot::version).orElse(0L);
        return AnalyticsResult.of(report, datasetVersion, queryTime,
            String.format("Primary cause %s (model %s)", report.primaryCause().feature(), published.model()));
    }
}
