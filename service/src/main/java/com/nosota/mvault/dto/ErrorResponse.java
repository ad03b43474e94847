package com.nosota.mvault.dto;

import java.time.LocalDateTime;

/**
 * Body of every error response.
 *
 * @param timestamp     When the error occurred
 * @param status        HTTP status code
 * @param error         Short error title
 * @param message       Error details
 * @param path          Request URI
 * @param correlationId Correlation id of the request (see CorrelationIdFilter)
 */
public record ErrorResponse(
        LocalDateTime timestamp,
        int status,
        String error,
        String message,
        String path,
        String correlationId
) {
    public static ErrorResponse of(int status, String error, String message, String path, String correlationId) {
        return new ErrorResponse(LocalDateTime.now(), status, error, message, path, correlationId);
    }
}
