package org.agentworld.runtime.pathfinding;

/**
 * An integer tile coordinate on the world grid.
 *
 * @param x Column index.
 * @param y Row index.
 */
public record Tile(int x, int y) {

    /**
     * Returns the tile displaced by the given offset.
     *
     * @param dx Column offset.
     * @param dy Row offset.
     * @return The neighbouring tile.
     */
    public Tile offset(final int dx, final int dy) {
        return new Tile(x + dx, y + dy);
    }

    /**
     * Checks whether the two tiles touch horizontally, vertically or diagonally.
     *
     * @param other The other tile.
     * @return {@code true} if the tiles are distinct and at most one step apart on each axis.
     */
    public boolean isAdjacentTo(final Tile other) {
        final int dx = Math.abs(x - other.x);
        final int dy = Math.abs(y - other.y);
        return (dx != 0 || dy != 0) && dx <= 1 && dy <= 1;
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
