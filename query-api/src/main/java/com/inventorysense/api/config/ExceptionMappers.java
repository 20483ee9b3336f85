package com.inventorysense.api.config;

import com.inventorysense.engine.errors.DataNotFoundException;
import com.inventorysense.engine.errors.DatasetNotLoadedException;
import com.inventorysense.engine.errors.InsufficientDataException;
import com.inventorysense.engine.errors.SchemaException;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import java.util.Map;

/**
 * Exception mappers for consistent JSON error responses.
 */
public class ExceptionMappers {

    private static final Logger LOG = Logger.getLogger(ExceptionMappers.class);

    @ServerExceptionMapper
    public Response handleNotFoundException(NotFoundException exception) {
        return error(Response.Status.NOT_FOUND,
            exception.getMessage() != null ? exception.getMessage() : "Resource not found");
    }

    @ServerExceptionMapper
    public Response handleDataNotFound(DataNotFoundException exception) {
        LOG.debugf("No data: %s", exception.getMessage());
        return error(Response.Status.NOT_FOUND, exception.getMessage());
    }

    @ServerExceptionMapper
    public Response handleSchemaException(SchemaException exception) {
        LOG.warnf("Rejected dataset: %s", exception.getMessage());
        return error(Response.Status.BAD_REQUEST, exception.getMessage());
    }

    @ServerExceptionMapper
    public Response handleInsufficientData(InsufficientDataException exception) {
        return error(Response.Status.BAD_REQUEST, exception.getMessage());
    }

    @ServerExceptionMapper
    public Response handleDatasetNotLoaded(DatasetNotLoadedException exception) {
        return error(Response.Status.BAD_REQUEST, exception.getMessage());
    }

    @ServerExceptionMapper
    public Response handleIllegalArgument(IllegalArgumentException exception) {
        return error(Response.Status.BAD_REQUEST,
            exception.getMessage() != null ? exception.getMessage() : "Invalid request");
    }

    private static Response error(Response.Status status, String message) {
        return Response.status(status)
            .type(MediaType.APPLICATION_JSON)
            .entity(Map.of(
                "error", message,
                "status", status.getStatusCode(),
                "timestamp", System.currentTimeMillis()
            ))
            .build();
    }
}
