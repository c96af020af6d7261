package org.agentworld.runtime.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The immutable result of processing one input.
 *
 * @param kind        {@link Kind#OK} or {@link Kind#ERROR}.
 * @param value       The handler's return value for OK outcomes, {@code null} otherwise.
 * @param message     The failure reason for ERROR outcomes, {@code null} otherwise.
 * @param completedAt Epoch millis at which the outcome was set.
 */
public record InputOutcome(Kind kind, JsonNode value, String message, long completedAt) {

    public enum Kind {
        OK,
        ERROR
    }

    public static InputOutcome ok(final JsonNode value, final long completedAt) {
        return new InputOutcome(Kind.OK, value, null, completedAt);
    }

    public static InputOutcome error(final String message, final long completedAt) {
        return new InputOutcome(Kind.ERROR, null, message, completedAt);
    }

    @JsonIgnore
    public boolean isOk() {
        return kind == Kind.OK;
    }
}
