package org.agentworld.runtime.model;

/**
 * Unit direction a player is looking at.
 */
public record Facing(double dx, double dy) {

    public static final Facing DOWN = new Facing(0, 1);

    /**
     * Normalizes the direction from {@code from} to {@code to}, keeping the previous facing when
     * both positions are equal.
     */
    public static Facing towards(final Position from, final Position to, final Facing previous) {
        final double dx = to.x() - from.x();
        final double dy = to.y() - from.y();
        final double length = Math.sqrt(dx * dx + dy * dy);
        if (length == 0.0) {
            return previous;
        }
        return new Facing(dx / length, dy / length);
    }
}
