package com.bookreader.exception;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Path;
import jakarta.ws.rs.core.Response;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Problem bodies returned by the extraction endpoints.
 */
public final class ExtractionProblems {

    public static final String INVALID_REQUEST_TYPE = "/problems/invalid-extraction-request";
    public static final String INVALID_REQUEST_TITLE = "Invalid extraction request";
    public static final String UNAVAILABLE_TYPE = "/problems/parsing-unavailable";
    public static final String UNAVAILABLE_TITLE = "Parsing temporarily unavailable";

    private ExtractionProblems() {
    }

    public static ErrorResponse invalidRequest(String field, String message, String instance) {
        return new ErrorResponse(
            INVALID_REQUEST_TYPE,
            INVALID_REQUEST_TITLE,
            Response.Status.BAD_REQUEST.getStatusCode(),
            field + ": " + message,
            instance
        );
    }

    public static ErrorResponse invalidRequest(Collection<? extends ConstraintViolation<?>> violations, String instance) {
        String detail = violations.stream()
            .map(v -> fieldOf(v.getPropertyPath()) + ": " + v.getMessage())
            .sorted()
            .collect(Collectors.joining("; "));
        return new ErrorResponse(
            INVALID_REQUEST_TYPE,
            INVALID_REQUEST_TITLE,
            Response.Status.BAD_REQUEST.getStatusCode(),
            detail.isEmpty() ? "Validation failed" : detail,
            instance
        );
    }

    public static ErrorResponse unavailable(String message, String instance) {
        return new ErrorResponse(
            UNAVAILABLE_TYPE,
            UNAVAILABLE_TITLE,
            Response.Status.SERVICE_UNAVAILABLE.getStatusCode(),
            message,
            instance
        );
    }

    /**
     * Last named node of a violation path: {@code extract.request.text} becomes {@code text}.
     */
    static String fieldOf(Path path) {
        String field = "request";
        for (Path.Node node : path) {
            if (node.getName() != null && !node.getName().isEmpty()) {
                field = node.getName();
            }
        }
        return field;
    }
}
