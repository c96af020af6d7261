package org.agentworld.runtime.store;

/**
 * A store operation failed. The operation had no effect.
 */
public class StoreException extends RuntimeException {

    public StoreException(final String message) {
        super(message);
    }

    public StoreException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
