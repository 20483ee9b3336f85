package com.inventorysense.api.config;

import com.inventorysense.engine.alert.AlertEngine;
import com.inventorysense.engine.context.DatasetContext;
import com.inventorysense.engine.correlation.CorrelationEngine;
import com.inventorysense.engine.correlation.RootCauseAnalyzer;
import com.inventorysense.engine.overview.InventoryOverviewEngine;
import com.inventorysense.engine.overview.RiskOverviewEngine;
import com.inventorysense.engine.trend.TrendEngine;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

/**
 * CDI producers for the plain-Java analytics engines.
 * The dataset context is a singleton so every request reads the same snapshot holder.
 */
public class EngineProducers {

    @Produces
    @Singleton
    DatasetContext datasetContext() {
        return new DatasetContext();
    }

    @Produces
    @Singleton
    TrendEngine trendEngine() {
        return new TrendEngine();
    }

    @Produces
    @Singleton
    AlertEngine alertEngine() {
        return new AlertEngine();
    }

    @Produces
    @Singleton
    CorrelationEngine correlationEngine() {
        return new CorrelationEngine();
    }

    @Produces
    @Singleton
    RootCauseAnalyzer rootCauseAnalyzer() {
        return new RootCauseAnalyzer();
    }

    @Produces
    @Singleton
    RiskOverviewEngine riskOverviewEngine() {
        return new RiskOverviewEngine();
    }

    @Produces
    @Singleton
    InventoryOverviewEngine inventoryOverviewEngine() {
        return new InventoryOverviewEngine();
    }
}
