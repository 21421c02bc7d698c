package com.bookreader.exception;

import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * No extractor is loaded: parsing is unavailable until configuration is fixed.
 */
@Provider
public class ProcessorConfigurationExceptionMapper implements ExceptionMapper<ProcessorConfigurationException> {

    private static final Logger LOG = Logger.getLogger(ProcessorConfigurationExceptionMapper.class);

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final ProcessorConfigurationException exception) {
        LOG.errorf("Extraction rejected: %s", exception.getMessage());

        final ErrorResponse error = ExtractionProblems.unavailable(
            exception.getMessage(), uriInfo != null ? uriInfo.getPath() : null);

        return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                .entity(error)
                .type("application/problem+json")
                .build();
    }
}
