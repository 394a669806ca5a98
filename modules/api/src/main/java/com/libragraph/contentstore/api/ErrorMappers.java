package com.libragraph.contentstore.api;

import com.libragraph.contentstore.core.asset.AssetBatchException;
import com.libragraph.contentstore.core.backend.BackendFailureException;
import com.libragraph.contentstore.core.envelope.EnvelopeCorruptException;
import com.libragraph.contentstore.core.envelope.EnvelopeNotFoundException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import java.util.Map;

/**
 * Translates coordinator failures into status codes. Bodies never carry
 * backend detail; that goes to the log at the point of failure.
 */
public class ErrorMappers {

    static final String ASSET_FAILURE_MESSAGE = "Unable to upload one or more assets!";

    @ServerExceptionMapper
    public Response notFound(EnvelopeNotFoundException e) {
        return Response.status(Response.Status.NOT_FOUND).build();
    }

    @ServerExceptionMapper
    public Response corrupt(EnvelopeCorruptException e) {
        return Response.serverError().build();
    }

    @ServerExceptionMapper
    public Response backendFailure(BackendFailureException e) {
        return Response.status(e.statusCode()).build();
    }

    @ServerExceptionMapper
    public Response assetBatch(AssetBatchException e) {
        return Response.serverError()
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("error", ASSET_FAILURE_MESSAGE))
                .build();
    }
}
