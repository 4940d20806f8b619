package br.edu.ifba.journal.exception;

import org.jboss.logging.Logger;

import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Maps a failed entry save to HTTP 500 so the client knows the journal text was not kept.
 */
@Provider
public class EntryPersistenceExceptionMapper implements ExceptionMapper<EntryPersistenceException> {

    private static final Logger LOG = Logger.getLogger(EntryPersistenceExceptionMapper.class);

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final EntryPersistenceException exception) {
        LOG.errorf(exception, "Entry persistence failed for %s", uriInfo.getPath());
        return ProblemResponses.of(Response.Status.INTERNAL_SERVER_ERROR,
                "The journal entry could not be saved: " + exception.getMessage(), uriInfo);
    }
}
