package org.agentworld.runtime.model;

import org.agentworld.runtime.pathfinding.Tile;

/**
 * A continuous position on the world grid. Tile {@code (x, y)} covers positions whose
 * coordinates round down to {@code x} and {@code y}.
 */
public record Position(double x, double y) {

    public static Position of(final Tile tile) {
        return new Position(tile.x(), tile.y());
    }

    public Tile toTile() {
        return new Tile((int) Math.floor(x), (int) Math.floor(y));
    }

    public double distanceTo(final Position other) {
        final double dx = x - other.x;
        final double dy = y - other.y;
        return Math.sqrt(dx * dx + dy * dy);
    }
}
