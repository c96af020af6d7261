package org.agentworld.runtime.model;

/**
 * Something a player is busy with until a point in time.
 *
 * @param description Free text shown to consumers.
 * @param emoji       Optional short symbol.
 * @param until       Epoch millis at which the activity ends.
 */
public record Activity(String description, String emoji, long until) {

    public boolean isOngoing(final long now) {
        return until > now;
    }
}
