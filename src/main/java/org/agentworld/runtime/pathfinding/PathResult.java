package org.agentworld.runtime.pathfinding;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a path search: either a complete route or {@link #NO_PATH}.
 * A found route always starts at the search start and ends at the goal.
 */
public final class PathResult {

    public static final PathResult NO_PATH = new PathResult(List.of(), Double.POSITIVE_INFINITY);

    private final List<Tile> waypoints;
    private final double cost;

    private PathResult(final List<Tile> waypoints, final double cost) {
        this.waypoints = waypoints;
        this.cost = cost;
    }

    static PathResult of(final List<Tile> waypoints, final double cost) {
        if (waypoints.isEmpty()) {
            throw new IllegalArgumentException("A found path contains at least its start tile");
        }
        return new PathResult(List.copyOf(waypoints), cost);
    }

    public boolean isFound() {
        return this != NO_PATH;
    }

    /**
     * @return The waypoints from start to goal inclusive, or an empty list for {@link #NO_PATH}.
     */
    public List<Tile> getWaypoints() {
        return waypoints;
    }

    public double getCost() {
        return cost;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof PathResult)) return false;
        final PathResult that = (PathResult) o;
        return waypoints.equals(that.waypoints);
    }

    @Override
    public int hashCode() {
        return Objects.hash(waypoints);
    }

    @Override
    public String toString() {
        return isFound() ? "PathResult" + waypoints : "NO_PATH";
    }
}
