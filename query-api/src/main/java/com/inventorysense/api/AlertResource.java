package com.inventorysense.api;

import com.inventorysense.api.model.AnalyticsResult;
import com.inventorysense.api.services.RiskAnalyticsService;
import com.inventorysense.engine.model.AlertFilter;
import com.inventorysense.engine.model.AlertReport;
import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST API for prioritized, deduplicated alerts.
 */
@Path("/api/alerts")
@Produces(MediaType.APPLICATION_JSON)
@Tag(name = "Alerts", description = "Severity alerts per distributor")
public class AlertResource {

    private static final Logger LOG = Logger.getLogger(AlertResource.class);

    @Inject
    RiskAnalyticsService riskService;

    @GET
    @Operation(
        summary = "Get alerts",
        description = "Returns one alert per distributor plus per-severity counts. Filters accept ALL to disable them"
    )
    public AnalyticsResult<AlertReport> getAlerts(@QueryParam("severity") @DefaultValue(AlertFilter.ALL) String severity,
                                                  @QueryParam("distributor") @DefaultValue(AlertFilter.ALL) String distributor,
                                                  @QueryParam("state") @DefaultValue(AlertFilter.ALL) String state) {
        LOG.infof("Alerts: severity=%s, distributor=%s, state=%s", severity, distributor, state);
        return riskService.alerts(severity, distributor, state);
    }
}
