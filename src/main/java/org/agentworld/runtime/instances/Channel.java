package org.agentworld.runtime.instances;

/**
 * A capacity-bounded shard of a zone, bound to one world.
 * <p>
 * Instances are owned by the {@link InstanceManager}; everything outside of it only ever sees
 * copies.
 */
public class Channel {

    private final long id;
    private final String name;
    private final String zoneType;
    private final ChannelType type;
    private final int maxBots;
    private final boolean defaultInstance;
    private final long createdAt;
    private ChannelStatus status;
    private int currentBots;
    private String worldId;
    private boolean needsWorldReassignment;
    private Long emptySince;
    private Long overCapacityUntil;

    public Channel(final long id, final String name, final String zoneType, final ChannelType type, final int maxBots,
                   final boolean defaultInstance, final long createdAt, final String worldId) {
        if (maxBots <= 0) {
            throw new IllegalArgumentException("maxBots must be positive, got " + maxBots);
        }
        this.id = id;
        this.name = name;
        this.zoneType = zoneType;
        this.type = type;
        this.maxBots = maxBots;
        this.defaultInstance = defaultInstance;
        this.createdAt = createdAt;
        this.worldId = worldId;
        this.status = ChannelStatus.ACTIVE;
    }

    /**
     * Restores an instance from its persisted form.
     */
    public static Channel restore(final long id, final String name, final String zoneType, final ChannelType type,
                                  final int maxBots, final boolean defaultInstance, final long createdAt,
                                  final String worldId, final ChannelStatus status, final int currentBots,
                                  final boolean needsWorldReassignment, final Long emptySince,
                                  final Long overCapacityUntil) {
        final Channel c = new Channel(id, name, zoneType, type, maxBots, defaultInstance, createdAt, worldId);
        c.status = status;
        c.currentBots = currentBots;
        c.needsWorldReassignment = needsWorldReassignment;
        c.emptySince = emptySince;
        c.overCapacityUntil = overCapacityUntil;
        return c;
    }

    public Channel copy() {
        return restore(id, name, zoneType, type, maxBots, defaultInstance, createdAt, worldId, status, currentBots,
            needsWorldReassignment, emptySince, overCapacityUntil);
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getZoneType() {
        return zoneType;
    }

    public ChannelType getType() {
        return type;
    }

    public int getMaxBots() {
        return maxBots;
    }

    public boolean isDefaultInstance() {
        return defaultInstance;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public ChannelStatus getStatus() {
        return status;
    }

    public int getCurrentBots() {
        return currentBots;
    }

    public String getWorldId() {
        return worldId;
    }

    public boolean isNeedsWorldReassignment() {
        return needsWorldReassignment;
    }

    public Long getEmptySince() {
        return emptySince;
    }

    public Long getOverCapacityUntil() {
        return overCapacityUntil;
    }

    public boolean isOverCapacityAllowed(final long now) {
        return overCapacityUntil != null && now < overCapacityUntil;
    }

    public double getLoadPercent() {
        return currentBots * 100.0 / maxBots;
    }

    void setStatus(final ChannelStatus status) {
        this.status = status;
    }

    void setCurrentBots(final int currentBots) {
        this.currentBots = currentBots;
    }

    void setWorldId(final String worldId) {
        this.worldId = worldId;
    }

    void setNeedsWorldReassignment(final boolean needsWorldReassignment) {
        this.needsWorldReassignment = needsWorldReassignment;
    }

    void setEmptySince(final Long emptySince) {
        this.emptySince = emptySince;
    }

    void setOverCapacityUntil(final Long overCapacityUntil) {
        this.overCapacityUntil = overCapacityUntil;
    }

    @Override
    public String toString() {
        return "Channel{id=" + id + ", name=" + name + ", status=" + status + ", load=" + currentBots + "/" + maxBots
            + ", world=" + worldId + "}";
    }
}
