package br.edu.ifba.journal.exception;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;

final class ProblemResponses {

    static final String PROBLEM_JSON = "application/problem+json";

    private ProblemResponses() {
    }

    static Response of(final Response.Status status, final String detail, final UriInfo uriInfo) {
        final ErrorResponse error = new ErrorResponse(
            "about:blank",
            status.getReasonPhrase(),
            status.getStatusCode(),
            detail,
            uriInfo != null ? uriInfo.getPath() : null
        );

        return Response.status(status)
                .entity(error)
                .type(PROBLEM_JSON)
                .build();
    }
}
