package com.inventorysense.api;

import com.inventorysense.api.model.UploadRequest;
import com.inventorysense.api.model.UploadResponse;
import com.inventorysense.api.services.DatasetService;
import com.inventorysense.engine.context.DatasetSnapshot;
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
import java.util.Optional;

/**
 * Dataset upload and service health.
 */
@Path("/api")
@Produces(MediaType.APPLICATION_JSON)
public class DatasetResource {

    private static final Logger LOG = Logger.getLogger(DatasetResource.class);

    @Inject
    DatasetService datasetService;

    @POST
    @Path("/upload")
    @Consumes(MediaType.APPLICATION_JSON)
    @Tag(name = "Upload", description = "Load the distributor dataset")
    @Operation(summary = "Upload dataset",
               description = "Replaces the current dataset with the uploaded rows and rebuilds the distributor-quarter table")
    public UploadResponse upload(UploadRequest request) {
        UploadResponse response = datasetService.upload(request);
        LOG.infof("Dataset v%d loaded: %d rows, %d distributor-quarters",
            response.datasetVersion(), response.rows(), response.distributorQuarters());
        return response;
    }

    @GET
    @Path("/health")
    @Tag(name = "Health")
    @Operation(summary = "Health check", description = "Check if the query API is healthy and whether a dataset is loaded")
    public Response health() {
        Optional<DatasetSnapshot> snapshot = datasetService.loaded();
        return Response.ok(Map.of(
            "status", "UP",
            "service", "inventory-sense-query-api",
            "dataset_loaded", snapshot.isPresent(),
            "dataset_version", snapshot.map(DatasetSnapshot::version).orElse(0L),
            "timestamp", System.currentTimeMillis()
        )).build();
    }
}
