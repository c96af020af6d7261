package org.agentworld.runtime.pathfinding;

/**
 * Neighbourhood used when expanding tiles during path search.
 */
public enum Connectivity {
    /** Up, down, left and right. */
    FOUR(new int[][]{{1, 0}, {-1, 0}, {0, 1}, {0, -1}}),
    /** The four cardinal directions plus the diagonals. */
    EIGHT(new int[][]{{1, 0}, {-1, 0}, {0, 1}, {0, -1}, {1, 1}, {1, -1}, {-1, 1}, {-1, -1}});

    private final int[][] offsets;

    Connectivity(final int[][] offsets) {
        this.offsets = offsets;
    }

    int[][] offsets() {
        return offsets;
    }
}
