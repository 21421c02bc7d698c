package com.bookreader.exception;

/**
 * RFC 7807 problem details body.
 */
public record ErrorResponse(
    String type,
    String title,
    int status,
    String detail,
    String instance
) {
}
