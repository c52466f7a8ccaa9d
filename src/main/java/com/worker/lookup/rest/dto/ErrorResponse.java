package com.worker.lookup.rest.dto;

import java.time.Instant;

/**
 * Error body returned by the lookup endpoints.
 */
public record ErrorResponse(
        int status,
        String error,
        String message,
        String path,
        Instant timestamp
) {
    public ErrorResponse(int status, String error, String message, String path) {
        this(status, error, message, path, Instant.now());
    }

    public static ErrorResponse badRequest(String message, String path) {
        return new ErrorResponse(400, "Bad Request", message, path);
    }

    public static ErrorResponse internalError(String path) {
        return new ErrorResponse(500, "Internal Server Error",
                "An internal error occurred. Check server logs for details.", path);
    }
}
