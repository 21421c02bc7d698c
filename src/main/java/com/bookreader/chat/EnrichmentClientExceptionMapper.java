package com.bookreader.chat;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.rest.client.ext.ResponseExceptionMapper;
import org.jboss.logging.Logger;

/**
 * Turns 4xx/5xx answers of the enrichment endpoint into exceptions that carry the response body.
 */
public class EnrichmentClientExceptionMapper implements ResponseExceptionMapper<RuntimeException> {

    private static final Logger LOG = Logger.getLogger(EnrichmentClientExceptionMapper.class);

    @Override
    public RuntimeException toThrowable(Response response) {
        if (response.getStatus() < 400) {
            return null;
        }

        String body = null;
        if (response.hasEntity()) {
            try {
                body = response.readEntity(String.class);
            } catch (RuntimeException e) {
                LOG.warnf(e, "Could not read enrichment error body");
            }
        }

        int status = response.getStatus();
        String reason = response.getStatusInfo().getReasonPhrase();
        LOG.errorf("Enrichment API returned %d %s: %s", status, reason,
            body == null || body.isEmpty() ? "(empty)" : body);

        return new WebApplicationException(
            String.format("Enrichment API returned %d %s%s", status, reason, body != null ? " - " + body : ""),
            response);
    }

    @Override
    public int getPriority() {
        return 4000;
    }
}
