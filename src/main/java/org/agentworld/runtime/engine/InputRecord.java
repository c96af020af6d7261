package org.agentworld.runtime.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One entry of a world's input log.
 *
 * @param worldId    The world the input targets.
 * @param number     Position in the world's log; assigned at submission, strictly increasing.
 * @param name       Command name.
 * @param args       Command arguments as submitted.
 * @param receivedAt Epoch millis of the submission.
 * @param outcome    {@code null} while the input is pending.
 */
public record InputRecord(String worldId, long number, String name, JsonNode args, long receivedAt, InputOutcome outcome) {

    public static InputRecord pending(final String worldId, final long number, final String name,
                                      final JsonNode args, final long receivedAt) {
        return new InputRecord(worldId, number, name, args, receivedAt, null);
    }

    public InputRecord withOutcome(final InputOutcome newOutcome) {
        if (outcome != null) {
            throw new IllegalStateException("Input " + worldId + "#" + number + " is already completed");
        }
        return new InputRecord(worldId, number, name, args, receivedAt, newOutcome);
    }

    @JsonIgnore
    public boolean isPending() {
        return outcome == null;
    }

    public long ageAt(final long now) {
        return now - receivedAt;
    }
}
