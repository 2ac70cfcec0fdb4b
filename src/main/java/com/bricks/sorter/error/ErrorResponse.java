package com.bricks.sorter.error;

import java.time.Instant;

/**
 * Common error body returned by the REST layer.
 *
 * @param timestamp time the error was produced
 * @param status    HTTP status code
 * @param error     HTTP reason phrase
 * @param message   human readable message
 * @param path      request path
 * @param code      application error code
 */
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path,
        String code
) {
    public static ErrorResponse of(int status, String error, String message, String path, String code) {
        return new ErrorResponse(Instant.now(), status, error, message, path, code);
    }
}
