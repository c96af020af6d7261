package org.agentworld.node.processes.http.api.dto;

import java.time.Instant;

/**
 * Body of every error response.
 *
 * @param timestamp ISO-8601 time of the error.
 * @param status    The HTTP status code.
 * @param error     The HTTP reason phrase.
 * @param message   What went wrong.
 */
public record ErrorResponseDto(
    String timestamp,
    int status,
    String error,
    String message
) {
    public static ErrorResponseDto of(final int status, final String error, final String message) {
        return new ErrorResponseDto(Instant.now().toString(), status, error, message);
    }
}
