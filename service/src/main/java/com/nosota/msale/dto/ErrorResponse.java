package com.nosota.msale.dto;

import org.slf4j.MDC;

import java.time.Instant;

/**
 * Error body returned by {@link com.nosota.msale.exception.GlobalExceptionHandler}.
 *
 * @param timestamp     When the error was produced
 * @param status        HTTP status code
 * @param error         Short error title
 * @param message       Detail message
 * @param path          Request URI
 * @param correlationId Correlation ID of the request, as logged
 */
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path,
        String correlationId
) {

    public static ErrorResponse of(int status, String error, String message, String path) {
        return new ErrorResponse(Instant.now(), status, error, message, path, MDC.get("correlationId"));
    }
}
