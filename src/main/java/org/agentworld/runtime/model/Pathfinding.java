package org.agentworld.runtime.model;

import org.agentworld.runtime.pathfinding.Tile;

import java.util.List;

/**
 * Immutable movement request of a player: where it wants to go, since when, and, once a route is
 * known, the waypoints and the index of the waypoint it is heading to.
 */
public record Pathfinding(Tile destination, long started, PathState state, List<Tile> waypoints, int nextWaypoint) {

    public Pathfinding {
        waypoints = waypoints == null ? List.of() : List.copyOf(waypoints);
    }

    public static Pathfinding requested(final Tile destination, final long now) {
        return new Pathfinding(destination, now, PathState.NEEDS_PATH, List.of(), 0);
    }

    public Pathfinding moving(final List<Tile> route) {
        // the first waypoint is the tile the player already stands on
        return new Pathfinding(destination, started, PathState.MOVING, route, Math.min(1, route.size() - 1));
    }

    public Pathfinding advancedTo(final int waypointIndex) {
        return new Pathfinding(destination, started, state, waypoints, waypointIndex);
    }

    public boolean hasRemainingWaypoints() {
        return state == PathState.MOVING && nextWaypoint < waypoints.size();
    }
}
