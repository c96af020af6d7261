package org.agentworld.runtime.model;

/**
 * A positioned, movable entity inside a world. It is controlled either by an agent or by an
 * external client.
 * <p>
 * Players are mutable but never shared between world copies: {@link #copy()} is used whenever the
 * engine prepares a new world state.
 */
public class Player {

    public static final String DEFAULT_ZONE = "downtown";

    private final String id;
    private final String name;
    private final String ownerId;
    private Position position;
    private Facing facing;
    private double speed;
    private Pathfinding pathfinding;
    private Activity activity;
    private String zone;
    private long lastInput;

    public Player(final String id, final String name, final String ownerId, final Position position,
                  final Facing facing, final String zone, final long lastInput) {
        this.id = id;
        this.name = name;
        this.ownerId = ownerId;
        this.position = position;
        this.facing = facing;
        this.zone = zone != null ? zone : DEFAULT_ZONE;
        this.lastInput = lastInput;
    }

    public Player copy() {
        final Player copy = new Player(id, name, ownerId, position, facing, zone, lastInput);
        copy.speed = speed;
        copy.pathfinding = pathfinding;
        copy.activity = activity;
        return copy;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    /**
     * @return The id of the external record owning this player, or {@code null} if the player
     *         has no external owner.
     */
    public String getOwnerId() {
        return ownerId;
    }

    public Position getPosition() {
        return position;
    }

    public void setPosition(final Position position) {
        this.position = position;
    }

    public Facing getFacing() {
        return facing;
    }

    public void setFacing(final Facing facing) {
        this.facing = facing;
    }

    public double getSpeed() {
        return speed;
    }

    public void setSpeed(final double speed) {
        this.speed = speed;
    }

    public Pathfinding getPathfinding() {
        return pathfinding;
    }

    public void setPathfinding(final Pathfinding pathfinding) {
        this.pathfinding = pathfinding;
    }

    /**
     * Cancels any movement and stands still.
     */
    public void stop() {
        this.pathfinding = null;
        this.speed = 0.0;
    }

    public Activity getActivity() {
        return activity;
    }

    public void setActivity(final Activity activity) {
        this.activity = activity;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(final String zone) {
        this.zone = zone;
    }

    public long getLastInput() {
        return lastInput;
    }

    public void setLastInput(final long lastInput) {
        this.lastInput = lastInput;
    }
}
