package org.agentworld.runtime.instances;

public enum ChannelStatus {
    /** Accepts allocations. */
    ACTIVE,
    /** At capacity; accepts allocations again once a slot is released. */
    FULL,
    /** Scheduled for shutdown; never receives new allocations. */
    DRAINING,
    /** Taken out of rotation, e.g. while waiting for a new world. */
    MAINTENANCE
}
