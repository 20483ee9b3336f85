package com.inventorysense.api;

import com.inventorysense.api.model.AnalyticsResult;
import com.inventorysense.api.model.CorrelationAnalysis;
import com.inventorysense.api.model.ImportancesRequest;
import com.inventorysense.api.services.FeatureImportanceStore;
import com.inventorysense.api.services.RiskAnalyticsService;
import com.inventorysense.engine.model.RootCauseReport;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import java.util.Map;

/**
 * REST API for feature correlation and model-driven root cause.
 */
@Path("/api")
@Produces(MediaType.APPLICATION_JSON)
public class AnalysisResource {

    private static final Logger LOG = Logger.getLogger(AnalysisResource.class);

    @Inject
    RiskAnalyticsService riskService;

    @Inject
    FeatureImportanceStore importanceStore;

    @GET
    @Path("/analysis/correlation")
    @Tag(name = "Correlation Analysis", description = "Relationships between numeric features")
    @Operation(
        summary = "Get correlation analysis",
        description = "Returns the Pearson correlation heatmap of all numeric columns with strong, moderate and inverse relationships"
    )
    public AnalyticsResult<CorrelationAnalysis> getCorrelation() {
        LOG.info("Correlation analysis");
        return riskService.correlation();
    }

    @POST
    @Path("/model/importances")
    @Consumes(MediaType.APPLICATION_JSON)
    @Tag(name = "Model Lab", description = "Results published by the model-training subsystem")
    @Operation(
        summary = "Publish feature importances",
        description = "Stores the feature importances of a trained model for root-cause analysis"
    )
    public Response publishImportances(ImportancesRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        FeatureImportanceStore.Published published = importanceStore.publish(request.model(), request.importances());
        return Response.ok(Map.of(
            "status", "published",
            "model", published.model() != null ? published.model() : "unknown",
            "features", published.importances().size(),
            "timestamp", published.publishedAt()
        )).build();
    }

    @GET
    @Path("/root-cause")
    @Tag(name = "Root Cause", description = "Ranked drivers of inventory waste")
    @Operation(
        summary = "Get root cause analysis",
        description = "Renormalizes the latest feature importances into contribution percentages with primary and secondary drivers"
    )
    public AnalyticsResult<RootCauseReport> getRootCause() {
        LOG.info("Root cause analysis");
        return riskService.rootCause();
    }
}
