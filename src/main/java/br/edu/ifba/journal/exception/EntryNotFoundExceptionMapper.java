package br.edu.ifba.journal.exception;

import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class EntryNotFoundExceptionMapper implements ExceptionMapper<EntryNotFoundException> {

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final EntryNotFoundException exception) {
        return ProblemResponses.of(Response.Status.NOT_FOUND, exception.getMessage(), uriInfo);
    }
}
