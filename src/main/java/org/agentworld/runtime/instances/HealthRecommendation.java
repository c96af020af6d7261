package org.agentworld.runtime.instances;

public enum HealthRecommendation {
    /** Load is above 90%; another shard should be opened. */
    SHARD,
    /** The instance has been empty for long enough to be shut down. */
    DRAIN,
    /** The world of the instance is gone; bind a new one. */
    REASSIGN_WORLD
}
