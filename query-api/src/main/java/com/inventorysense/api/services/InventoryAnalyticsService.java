package com.inventorysense.api.services;

import com.inventorysense.api.model.AnalyticsResult;
import com.inventorysense.engine.context.DatasetContext;
import com.inventorysense.engine.context.DatasetSnapshot;
import com.inventorysense.engine.model.DistributorAllowanceStatus;
import com.inventorysense.engine.model.InventoryOverview;
import com.inventorysense.engine.model.MonthlyWaste;
import com.inventorysense.engine.overview.InventoryOverviewEngine;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;

/**
 * Inventory dashboard queries over the current dataset snapshot.
 */
@ApplicationScoped
public class InventoryAnalyticsService {

    @Inject
    DatasetContext datasetContext;

    @Inject
    InventoryOverviewEngine inventoryEngine;

    public AnalyticsResult<InventoryOverview> overview() {
        long startTime = System.currentTimeMillis();
        DatasetSnapshot snapshot = datasetContext.current();

        InventoryOverview overview = inventoryEngine.overview(snapshot.records());

        long queryTime = System.currentTimeMillis() - startTime;
        return AnalyticsResult.of(overview, snapshot.version(), queryTime,
            String.format("Utilization %s%%", overview.utilizationRate()));
    }

    public AnalyticsResult<List<MonthlyWaste>> charts() {
        long startTime = System.currentTimeMillis();
        DatasetSnapshot snapshot = datasetContext.current();

        List<MonthlyWaste> chart = inventoryEngine.monthlyChart(snapshot.records());

        long queryTime = System.currentTimeMillis() - startTime;
        return AnalyticsResult.of(chart, snapshot.version(), queryTime,
            String.format("%d months of allowed vs actual waste", chart.size()));
    }

    public AnalyticsResult<List<DistributorAllowanceStatus>> distributorStatus() {
        long startTime = System.currentTimeMillis();
        DatasetSnapshot snapshot = datasetContext.current();

        List<DistributorAllowanceStatus> statuses = inventoryEngine.distributorStatus(snapshot.records());

        long queryTime = System.currentTimeMillis() - startTime;
        return AnalyticsResult.of(statuses, snapshot.version(), queryTime,
            String.format("%d distributors", statuses.size()));
    }
}
