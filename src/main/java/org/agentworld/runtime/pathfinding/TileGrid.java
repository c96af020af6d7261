package org.agentworld.runtime.pathfinding;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Immutable description of the walkable area of a world: its dimensions, the tiles that are
 * permanently blocked by the map and the neighbourhood used for movement.
 */
public final class TileGrid {

    private final int width;
    private final int height;
    private final Connectivity connectivity;
    private final Set<Tile> obstacles;

    public TileGrid(final int width, final int height, final Connectivity connectivity, final Collection<Tile> obstacles) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive, got " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.connectivity = connectivity;
        this.obstacles = Collections.unmodifiableSet(new LinkedHashSet<>(obstacles));
    }

    public static TileGrid open(final int width, final int height, final Connectivity connectivity) {
        return new TileGrid(width, height, connectivity, Set.of());
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public Connectivity getConnectivity() {
        return connectivity;
    }

    public Set<Tile> getObstacles() {
        return obstacles;
    }

    public boolean inBounds(final Tile tile) {
        return tile.x() >= 0 && tile.y() >= 0 && tile.x() < width && tile.y() < height;
    }

    /**
     * A tile is walkable if it lies inside the grid and is neither a map obstacle nor in the
     * additional set of dynamically blocked tiles.
     */
    public boolean isWalkable(final Tile tile, final Set<Tile> blocked) {
        return inBounds(tile) && !obstacles.contains(tile) && !blocked.contains(tile);
    }
}
