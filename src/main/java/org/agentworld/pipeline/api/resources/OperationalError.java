package org.agentworld.pipeline.api.resources;

import java.time.Instant;

/**
 * A transient error recorded by a pipeline component.
 *
 * @param timestamp When the error occurred.
 * @param errorType A category for the error (e.g. "STEP_COMMIT_FAILED").
 * @param message   A human-readable description of the error.
 * @param details   Optional context, such as the affected world.
 */
public record OperationalError(
    Instant timestamp,
    String errorType,
    String message,
    String details
) {
}
