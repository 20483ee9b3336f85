package com.inventorysense.api;

import com.inventorysense.api.model.AnalyticsResult;
import com.inventorysense.api.services.InventoryAnalyticsService;
import com.inventorysense.engine.model.DistributorAllowanceStatus;
import com.inventorysense.engine.model.InventoryOverview;
import com.inventorysense.engine.model.MonthlyWaste;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * REST API for the inventory dashboard.
 */
@Path("/api/inventory")
@Produces(MediaType.APPLICATION_JSON)
@Tag(name = "Inventory", description = "Waste against allowance")
public class InventoryResource {

    private static final Logger LOG = Logger.getLogger(InventoryResource.class);

    @Inject
    InventoryAnalyticsService inventoryService;

    @GET
    @Path("/overview")
    @Operation(summary = "Get inventory KPIs",
               description = "Returns total waste, total allowance, utilization rate and the number of high-risk states")
    public AnalyticsResult<InventoryOverview> getOverview() {
        LOG.info("Inventory overview");
        return inventoryService.overview();
    }

    @GET
    @Path("/charts")
    @Operation(summary = "Get allowed vs actual chart",
               description = "Returns monthly allowed and actual waste for the most recent months")
    public AnalyticsResult<List<MonthlyWaste>> getCharts() {
        LOG.info("Inventory charts");
        return inventoryService.charts();
    }

    @GET
    @Path("/distributor-status")
    @Operation(summary = "Get distributor allowance status",
               description = "Returns allowance usage and status badge per distributor, highest usage first")
    public AnalyticsResult<List<DistributorAllowanceStatus>> getDistributorStatus() {
        LOG.info("Distributor allowance status");
        return inventoryService.distributorStatus();
    }
}
