package org.agentworld.runtime.engine;

/**
 * Thrown by {@code submit} when a world already has too many unprocessed inputs.
 */
public class InputRejectedException extends RuntimeException {

    public InputRejectedException(final String message) {
        super(message);
    }
}
