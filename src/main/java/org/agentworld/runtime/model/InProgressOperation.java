package org.agentworld.runtime.model;

/**
 * An operation an agent has started outside the engine (e.g. asking its decision policy what to
 * do next) and whose result has not come back yet.
 *
 * @param name        Operation name, e.g. {@code agentDoSomething}.
 * @param operationId Opaque correlation id that the finishing command must echo.
 * @param started     Epoch millis at which the operation started.
 */
public record InProgressOperation(String name, String operationId, long started) {

    public long ageAt(final long now) {
        return now - started;
    }
}
