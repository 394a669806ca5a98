package com.libragraph.contentstore.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libragraph.contentstore.core.envelope.Envelope;
import com.libragraph.contentstore.core.envelope.EnvelopeCoordinator;
import com.libragraph.contentstore.util.ContentId;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/**
 * Store, retrieve, and delete metadata envelopes by content ID.
 */
@Path("/content/{id}")
@Produces(MediaType.APPLICATION_JSON)
public class ContentResource {

    @Inject
    EnvelopeCoordinator coordinator;

    @PUT
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> store(@PathParam("id") String id, JsonNode body) {
        if (body == null || !body.isObject()) {
            throw new BadRequestException("Envelope must be a JSON object");
        }
        return coordinator.store(ContentId.of(id), new Envelope((ObjectNode) body))
                .replaceWith(() -> Response.noContent().build());
    }

    @GET
    public Uni<ObjectNode> retrieve(@PathParam("id") String id) {
        return coordinator.retrieve(ContentId.of(id))
                .onItem().transform(Envelope::document);
    }

    @DELETE
    public Uni<Response> delete(@PathParam("id") String id) {
        return coordinator.delete(ContentId.of(id))
                .replaceWith(() -> Response.noContent().build());
    }
}
