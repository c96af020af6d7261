package org.agentworld.runtime.instances;

/**
 * Thrown when no instance can take a bot and a new one could not be created.
 */
public class InstanceAllocationException extends RuntimeException {

    public InstanceAllocationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
