package org.agentworld.runtime.instances;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Distributes bots over capacity-bounded instances of a zone and opens new shards on demand.
 * <p>
 * All operations are serialized on the manager. After every operation the status of each touched
 * instance matches its load: an instance that is neither draining nor in maintenance is
 * {@link ChannelStatus#FULL} exactly when {@code currentBots >= maxBots}.
 * <p>
 * Changes are made on a copy of the instance, which replaces the registered instance only after
 * the store accepted it. A failed save leaves the manager unchanged.
 */
public class InstanceManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(InstanceManager.class);
    private static final double NEAR_CAPACITY_PERCENT = 90.0;

    private final IWorldDirectory worlds;
    private final IChannelStore store;
    private final Clock clock;
    private final String defaultZone;
    private final long emptyDrainAfterMs;
    private final Map<Long, Channel> instances = new LinkedHashMap<>();
    private long nextInstanceId = 1;

    public InstanceManager(final IWorldDirectory worlds, final IChannelStore store, final Clock clock,
                           final String defaultZone, final long emptyDrainAfterMs) {
        this.worlds = worlds;
        this.store = store;
        this.clock = clock;
        this.defaultZone = defaultZone;
        this.emptyDrainAfterMs = emptyDrainAfterMs;
        for (final Channel channel : store.loadInstances()) {
            instances.put(channel.getId(), channel);
            nextInstanceId = Math.max(nextInstanceId, channel.getId() + 1);
        }
        if (!instances.isEmpty()) {
            LOGGER.debug("Restored {} instances", instances.size());
        }
    }

    /**
     * Places one bot into the least loaded instance of the zone, creating a new instance if all of
     * them are full, draining or in maintenance.
     *
     * @throws InstanceAllocationException if a new instance is needed but its world cannot be created.
     */
    public synchronized InstanceAllocation findOrCreateInstance(final String zoneType) {
        final long now = clock.millis();
        final Optional<Channel> candidate = instances.values().stream()
            .filter(c -> c.getZoneType().equals(zoneType))
            .filter(c -> c.getWorldId() != null && acceptsBots(c, now))
            .min(Comparator.comparingInt(Channel::getCurrentBots).thenComparingLong(Channel::getId));

        if (candidate.isPresent()) {
            final Channel channel = candidate.get().copy();
            channel.setCurrentBots(channel.getCurrentBots() + 1);
            channel.setEmptySince(null);
            updateStatusByLoad(channel);
            commit(channel);
            LOGGER.debug("Allocated slot in instance {} ({}/{})", channel.getName(), channel.getCurrentBots(), channel.getMaxBots());
            return new InstanceAllocation(channel.getId(), channel.getWorldId(), false);
        }

        final Channel created = newInstance(zoneType, ChannelType.GENERAL, false, now);
        created.setCurrentBots(1);
        updateStatusByLoad(created);
        register(created);
        return new InstanceAllocation(created.getId(), created.getWorldId(), true);
    }

    /**
     * Gives one slot back. Never lets the load drop below zero.
     */
    public synchronized Channel releaseSlot(final long instanceId) {
        final Channel channel = require(instanceId);
        channel.setCurrentBots(Math.max(0, channel.getCurrentBots() - 1));
        if (channel.getCurrentBots() == 0 && channel.getEmptySince() == null) {
            channel.setEmptySince(clock.millis());
        }
        updateStatusByLoad(channel);
        return commit(channel);
    }

    public synchronized Channel markDraining(final long instanceId) {
        final Channel channel = require(instanceId);
        channel.setStatus(ChannelStatus.DRAINING);
        final Channel saved = commit(channel);
        LOGGER.info("Instance {} is draining", channel.getName());
        return saved;
    }

    public synchronized Channel setMaintenance(final long instanceId, final boolean maintenance) {
        final Channel channel = require(instanceId);
        if (maintenance) {
            channel.setStatus(ChannelStatus.MAINTENANCE);
        } else {
            if (channel.getWorldId() == null) {
                throw new IllegalStateException("Instance " + channel.getName() + " has no world assigned");
            }
            channel.setStatus(ChannelStatus.ACTIVE);
            updateStatusByLoad(channel);
        }
        final Channel saved = commit(channel);
        LOGGER.info("Instance {} maintenance={}", channel.getName(), maintenance);
        return saved;
    }

    /**
     * Allows the instance to exceed its capacity until {@code until} (epoch millis).
     */
    public synchronized Channel grantOverCapacity(final long instanceId, final long until) {
        final Channel channel = require(instanceId);
        channel.setOverCapacityUntil(until);
        return commit(channel);
    }

    /**
     * Binds a freshly created world and puts the instance back into rotation.
     */
    public synchronized Channel reassignWorld(final long instanceId) {
        final Channel channel = require(instanceId);
        final String worldId = createWorld(channel.getName());
        channel.setWorldId(worldId);
        channel.setNeedsWorldReassignment(false);
        channel.setStatus(ChannelStatus.ACTIVE);
        updateStatusByLoad(channel);
        final Channel saved = commit(channel);
        LOGGER.info("Instance {} is now bound to world {}", channel.getName(), worldId);
        return saved;
    }

    /**
     * Unbinds the world of an instance and takes it out of rotation until a new world is assigned.
     */
    public synchronized Channel resetForReassignment(final long instanceId) {
        final Channel channel = require(instanceId);
        final String previous = channel.getWorldId();
        channel.setWorldId(null);
        channel.setNeedsWorldReassignment(true);
        channel.setStatus(ChannelStatus.MAINTENANCE);
        final Channel saved = commit(channel);
        LOGGER.warn("Instance {} lost its world {}, needs world reassignment", channel.getName(), previous);
        return saved;
    }

    /**
     * Creates the default instance of the default zone if there are no instances at all.
     *
     * @return The default instance, or empty if instances already existed.
     */
    public synchronized Optional<Channel> initializeDefaultInstance() {
        if (!instances.isEmpty()) {
            return Optional.empty();
        }
        final Channel channel = newInstance(defaultZone, ChannelType.GENERAL, true, clock.millis());
        channel.setEmptySince(channel.getCreatedAt());
        return Optional.of(register(channel));
    }

    public synchronized Optional<Channel> findInstance(final long instanceId) {
        return Optional.ofNullable(instances.get(instanceId)).map(Channel::copy);
    }

    public synchronized List<Channel> listInstances() {
        final List<Channel> copies = new ArrayList<>();
        instances.values().forEach(c -> copies.add(c.copy()));
        return copies;
    }

    /**
     * Inspects every instance and recommends corrective actions. Does not change anything.
     */
    public synchronized List<ChannelHealth> healthReport() {
        final long now = clock.millis();
        final List<ChannelHealth> report = new ArrayList<>();
        for (final Channel channel : instances.values()) {
            final List<String> issues = new ArrayList<>();
            final List<HealthRecommendation> recommendations = new ArrayList<>();

            if (channel.getWorldId() == null) {
                issues.add("No world assigned");
                recommendations.add(HealthRecommendation.REASSIGN_WORLD);
            } else if (!worlds.isWorldAlive(channel.getWorldId())) {
                issues.add("World is invalid or inaccessible");
                recommendations.add(HealthRecommendation.REASSIGN_WORLD);
            }

            final double load = channel.getLoadPercent();
            if (channel.getCurrentBots() >= channel.getMaxBots()) {
                issues.add("Instance is at full capacity");
            } else if (load > NEAR_CAPACITY_PERCENT) {
                issues.add("Instance is near capacity (>90%)");
            }
            if (load > NEAR_CAPACITY_PERCENT) {
                recommendations.add(HealthRecommendation.SHARD);
            }

            if (channel.getStatus() == ChannelStatus.DRAINING || channel.getStatus() == ChannelStatus.MAINTENANCE) {
                issues.add("Instance status is " + channel.getStatus());
            }

            if (!channel.isDefaultInstance() && channel.getCurrentBots() == 0 && channel.getEmptySince() != null
                    && now - channel.getEmptySince() > emptyDrainAfterMs
                    && channel.getStatus() != ChannelStatus.DRAINING) {
                recommendations.add(HealthRecommendation.DRAIN);
            }

            report.add(new ChannelHealth(channel.getId(), channel.getName(), channel.getZoneType(), channel.getStatus(),
                channel.getWorldId(), channel.getCurrentBots(), channel.getMaxBots(), load, issues.isEmpty(),
                List.copyOf(issues), List.copyOf(recommendations)));
        }
        return report;
    }

    private boolean acceptsBots(final Channel channel, final long now) {
        if (channel.getStatus() == ChannelStatus.ACTIVE && channel.getCurrentBots() < channel.getMaxBots()) {
            return true;
        }
        return (channel.getStatus() == ChannelStatus.ACTIVE || channel.getStatus() == ChannelStatus.FULL)
            && channel.isOverCapacityAllowed(now);
    }

    /**
     * Builds an instance bound to a fresh world. It is not registered until {@link #register(Channel)}.
     */
    private Channel newInstance(final String zoneType, final ChannelType type, final boolean defaultInstance, final long now) {
        final long existing = instances.values().stream().filter(c -> c.getZoneType().equals(zoneType)).count();
        final String name = existing == 0 ? zoneType : zoneType + "-shard-" + (existing + 1);
        final String worldId = createWorld(name);
        return new Channel(nextInstanceId, name, zoneType, type, type.getDefaultMaxBots(), defaultInstance, now, worldId);
    }

    private Channel register(final Channel created) {
        final Channel saved = commit(created);
        nextInstanceId++;
        LOGGER.info("Created instance {} ({}) bound to world {}", created.getName(), created.getId(), created.getWorldId());
        return saved;
    }

    /**
     * Saves the changed instance and, once the store accepted it, makes it the registered one.
     *
     * @return A copy of the saved instance.
     */
    private Channel commit(final Channel changed) {
        store.saveInstance(changed);
        instances.put(changed.getId(), changed);
        return changed.copy();
    }

    private String createWorld(final String instanceName) {
        try {
            return worlds.createWorld();
        } catch (final RuntimeException e) {
            throw new InstanceAllocationException("Failed to create a world for instance " + instanceName, e);
        }
    }

    private static void updateStatusByLoad(final Channel channel) {
        if (channel.getStatus() == ChannelStatus.DRAINING || channel.getStatus() == ChannelStatus.MAINTENANCE) {
            return;
        }
        channel.setStatus(channel.getCurrentBots() >= channel.getMaxBots() ? ChannelStatus.FULL : ChannelStatus.ACTIVE);
    }

    /**
     * @return A working copy of the instance; register it with {@link #commit(Channel)}.
     */
    private Channel require(final long instanceId) {
        final Channel channel = instances.get(instanceId);
        if (channel == null) {
            throw new IllegalArgumentException("Unknown instance " + instanceId);
        }
        return channel.copy();
    }
}
