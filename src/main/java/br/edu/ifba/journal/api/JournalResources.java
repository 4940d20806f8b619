package br.edu.ifba.journal.api;

import java.net.URI;
import java.util.List;
import java.util.UUID;

import br.edu.ifba.journal.JournalService;
import br.edu.ifba.journal.pipeline.SaveOutcome;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/**
 * Journal endpoints of one user. The owner id is taken from the path; authentication happens
 * in front of this service.
 */
@Path("/journal/{ownerId}")
@Produces(MediaType.APPLICATION_JSON)
public class JournalResources {

    @Inject
    JournalService journalService;

    @POST
    @Path("/sessions/{sessionId}/turns")
    @Consumes(MediaType.APPLICATION_JSON)
    public TurnResponse turn(
            @PathParam("ownerId") final String ownerId,
            @PathParam("sessionId") final String sessionId,
            @NotNull @Valid final TurnRequest request) {
        return TurnResponse.from(journalService.handleTurn(ownerId, sessionId, request.message()));
    }

    @POST
    @Path("/sessions/{sessionId}/entries")
    public Response saveSession(
            @PathParam("ownerId") final String ownerId,
            @PathParam("sessionId") final String sessionId) {
        final SaveOutcome saved = journalService.saveEntry(ownerId, sessionId);
        return Response.created(URI.create("/journal/" + ownerId + "/entries/" + saved.entryId()))
                .entity(EntryCreatedResponse.from(saved))
                .build();
    }

    @GET
    @Path("/entries")
    public List<EntryResponse> list(
            @PathParam("ownerId") final String ownerId,
            @QueryParam("limit") @DefaultValue("50") @Min(1) @Max(200) final int limit) {
        return journalService.listEntries(ownerId, limit).stream()
                .map(EntryResponse::from)
                .toList();
    }

    @GET
    @Path("/entries/recent")
    public List<EntryResponse> recent(@PathParam("ownerId") final String ownerId) {
        return journalService.recentEntries(ownerId).stream()
                .map(EntryResponse::from)
                .toList();
    }

    @GET
    @Path("/entries/{id}")
    public EntryResponse get(@PathParam("ownerId") final String ownerId, @PathParam("id") final UUID id) {
        return EntryResponse.from(journalService.getEntry(ownerId, id));
    }

    @DELETE
    @Path("/entries/{id}")
    public Response delete(@PathParam("ownerId") final String ownerId, @PathParam("id") final UUID id) {
        journalService.deleteEntry(ownerId, id);
        return Response.noContent().build();
    }
}
