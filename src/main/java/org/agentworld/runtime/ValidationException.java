package org.agentworld.runtime;

/**
 * Thrown when a command references something that does not exist, is issued by an actor who
 * is not allowed to issue it, or carries malformed arguments.
 * <p>
 * A validation failure never changes world state. The caller may correct the input and
 * resubmit it.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(final String message) {
        super(message);
    }

    public ValidationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
