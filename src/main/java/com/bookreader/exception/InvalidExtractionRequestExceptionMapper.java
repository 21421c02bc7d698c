package com.bookreader.exception;

import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

@Provider
public class InvalidExtractionRequestExceptionMapper implements ExceptionMapper<InvalidExtractionRequestException> {

    private static final Logger LOG = Logger.getLogger(InvalidExtractionRequestExceptionMapper.class);

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final InvalidExtractionRequestException exception) {
        LOG.warnf("Rejected extraction request, %s: %s", exception.getField(), exception.getMessage());

        final ErrorResponse error = ExtractionProblems.invalidRequest(
            exception.getField(), exception.getMessage(), uriInfo != null ? uriInfo.getPath() : null);

        return Response.status(Response.Status.BAD_REQUEST)
                .entity(error)
                .type("application/problem+json")
                .build();
    }
}
