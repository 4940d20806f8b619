package br.edu.ifba.journal.client;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.rest.client.ext.ResponseExceptionMapper;
import org.jboss.logging.Logger;

/**
 * Turns error responses of the model endpoints into exceptions that carry the response body,
 * so a rejected request shows why in the logs.
 */
public class LlmClientExceptionMapper implements ResponseExceptionMapper<RuntimeException> {

    private static final Logger LOG = Logger.getLogger(LlmClientExceptionMapper.class);

    private static final int MAX_BODY_CHARS = 500;

    @Override
    public RuntimeException toThrowable(final Response response) {
        if (response.getStatus() < 400) {
            return null;
        }

        String responseBody = null;
        try {
            if (response.hasEntity()) {
                responseBody = response.readEntity(String.class);
            }
        } catch (RuntimeException e) {
            LOG.warnf("Failed to read error response body: %s", e.getMessage());
        }

        final int status = response.getStatus();
        final String statusInfo = response.getStatusInfo().getReasonPhrase();
        final String body = responseBody == null || responseBody.isEmpty()
            ? "(empty)"
            : abbreviate(responseBody);

        LOG.errorf("Model endpoint returned %d %s: %s", status, statusInfo, body);

        return new WebApplicationException(
            String.format("Model endpoint returned %d %s - %s", status, statusInfo, body),
            response);
    }

    private static String abbreviate(final String body) {
        return body.length() <= MAX_BODY_CHARS ? body : body.substring(0, MAX_BODY_CHARS) + "...";
    }

    @Override
    public int getPriority() {
        return 4000;
    }
}
