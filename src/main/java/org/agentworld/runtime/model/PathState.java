package org.agentworld.runtime.model;

/**
 * Progress of a player's movement request.
 */
public enum PathState {
    /** A destination is set but no route has been computed yet. */
    NEEDS_PATH,
    /** A route is being followed. */
    MOVING
}
