package org.agentworld.runtime.pathfinding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * A* search over a {@link TileGrid}.
 * <p>
 * The frontier is a min-heap ordered by {@code g + h}. Entries with equal priority are polled
 * in insertion order, so identical inputs always produce the identical route. Diagonal moves
 * (only with {@link Connectivity#EIGHT}) cost {@code sqrt(2)} and may not cut the corner of a
 * blocked tile.
 * <p>
 * The class holds no state; every call is independent.
 */
public final class Pathfinder {

    private static final double DIAGONAL_COST = Math.sqrt(2.0);

    private Pathfinder() {
        // static utility
    }

    /**
     * Finds the cheapest walkable route from {@code start} to {@code goal}.
     *
     * @param grid    The map, including its permanent obstacles.
     * @param blocked Additional tiles that must not be entered (e.g. occupied by other players).
     *                The start tile is never treated as blocked.
     * @param start   The tile to start from.
     * @param goal    The tile to reach.
     * @return The route from start to goal inclusive, or {@link PathResult#NO_PATH} if the goal
     *         cannot be reached. Never a partial route.
     */
    public static PathResult findPath(final TileGrid grid, final Set<Tile> blocked, final Tile start, final Tile goal) {
        if (!grid.inBounds(start) || !grid.isWalkable(goal, blocked)) {
            return PathResult.NO_PATH;
        }
        if (start.equals(goal)) {
            return PathResult.of(List.of(start), 0.0);
        }

        final PriorityQueue<FrontierEntry> open = new PriorityQueue<>(
            Comparator.comparingDouble(FrontierEntry::priority).thenComparingLong(FrontierEntry::sequence));
        final Map<Tile, Double> bestCost = new HashMap<>();
        final Map<Tile, Tile> cameFrom = new HashMap<>();
        final Set<Tile> closed = new HashSet<>();
        long sequence = 0;

        bestCost.put(start, 0.0);
        open.add(new FrontierEntry(start, 0.0, heuristic(grid.getConnectivity(), start, goal), sequence++));

        while (!open.isEmpty()) {
            final FrontierEntry current = open.poll();
            if (!closed.add(current.tile())) {
                continue;
            }
            if (current.tile().equals(goal)) {
                return PathResult.of(reconstruct(cameFrom, goal), current.cost());
            }

            for (final int[] d : grid.getConnectivity().offsets()) {
                final Tile next = current.tile().offset(d[0], d[1]);
                if (closed.contains(next) || !grid.isWalkable(next, blocked)) {
                    continue;
                }
                final boolean diagonal = d[0] != 0 && d[1] != 0;
                if (diagonal && (!grid.isWalkable(current.tile().offset(d[0], 0), blocked)
                        || !grid.isWalkable(current.tile().offset(0, d[1]), blocked))) {
                    continue;
                }
                final double cost = current.cost() + (diagonal ? DIAGONAL_COST : 1.0);
                final Double known = bestCost.get(next);
                if (known != null && known <= cost) {
                    continue;
                }
                bestCost.put(next, cost);
                cameFrom.put(next, current.tile());
                open.add(new FrontierEntry(next, cost, cost + heuristic(grid.getConnectivity(), next, goal), sequence++));
            }
        }
        return PathResult.NO_PATH;
    }

    private static double heuristic(final Connectivity connectivity, final Tile from, final Tile to) {
        final int dx = Math.abs(from.x() - to.x());
        final int dy = Math.abs(from.y() - to.y());
        if (connectivity == Connectivity.FOUR) {
            return dx + dy;
        }
        // octile distance
        return Math.max(dx, dy) + (DIAGONAL_COST - 1.0) * Math.min(dx, dy);
    }

    private static List<Tile> reconstruct(final Map<Tile, Tile> cameFrom, final Tile goal) {
        final List<Tile> path = new ArrayList<>();
        Tile step = goal;
        while (step != null) {
            path.add(step);
            step = cameFrom.get(step);
        }
        Collections.reverse(path);
        return path;
    }

    private record FrontierEntry(Tile tile, double cost, double priority, long sequence) {
    }
}
