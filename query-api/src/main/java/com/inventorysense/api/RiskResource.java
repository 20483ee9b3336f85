package com.inventorysense.api;

import com.inventorysense.api.model.AnalyticsResult;
import com.inventorysense.api.services.RiskAnalyticsService;
import com.inventorysense.engine.model.DistributorTrend;
import com.inventorysense.engine.model.QuarterComparison;
import com.inventorysense.engine.model.RiskOverview;
import com.inventorysense.engine.model.TopRiskyDistributor;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * REST API for distributor risk: overview, trends, quarter comparison and ranking.
 */
@Path("/api/risk")
@Produces(MediaType.APPLICATION_JSON)
@Tag(name = "Risk", description = "Distributor risk derived from the distributor-quarter table")
public class RiskResource {

    private static final Logger LOG = Logger.getLogger(RiskResource.class);

    @Inject
    RiskAnalyticsService riskService;

    @GET
    @Path("/overview")
    @Operation(
        summary = "Get risk overview",
        description = "Returns state-wise waste, the riskiest distributors and key insights, optionally filtered by year and month"
    )
    public AnalyticsResult<RiskOverview> getOverview(@QueryParam("year") List<String> years,
                                                     @QueryParam("month") List<String> months) {
        LOG.infof("Risk overview: years=%s, months=%s", years, months);
        return riskService.riskOverview(years, months);
    }

    @GET
    @Path("/distributor-trend")
    @Operation(
        summary = "Get distributor trend",
        description = "Returns the quarter-by-quarter waste trend of one distributor"
    )
    public AnalyticsResult<DistributorTrend> getDistributorTrend(@QueryParam("distributor_id") Integer distributorId) {
        if (distributorId == null) {
            throw new IllegalArgumentException("distributor_id is required");
        }
        LOG.infof("Distributor trend for %d", distributorId);
        return riskService.distributorTrend(distributorId);
    }

    @GET
    @Path("/quarter-comparison")
    @Operation(
        summary = "Compare two quarters",
        description = "Compares the waste of one or two distributors in a state between two quarters labelled like '2022 Q2'"
    )
    public AnalyticsResult<QuarterComparison> getQuarterComparison(@QueryParam("state") String state,
                                                                   @QueryParam("quarter_a") String quarterA,
                                                                   @QueryParam("quarter_b") String quarterB,
                                                                   @QueryParam("distributor_1") Integer distributor1,
                                                                   @QueryParam("distributor_2") Integer distributor2) {
        LOG.infof("Quarter comparison in %s: %s vs %s for %s/%s", state, quarterA, quarterB, distributor1, distributor2);
        return riskService.compareQuarters(state, quarterA, quarterB, distributor1, distributor2);
    }

    @GET
    @Path("/top-risky")
    @Operation(
        summary = "Get top risky distributors",
        description = "Returns the distributor-quarters furthest above their waste allowance"
    )
    public AnalyticsResult<List<TopRiskyDistributor>> getTopRisky() {
        LOG.info("Top risky distributors");
        return riskService.topRisky();
    }
}
