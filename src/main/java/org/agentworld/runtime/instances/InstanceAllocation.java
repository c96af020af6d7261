package org.agentworld.runtime.instances;

/**
 * Result of a successful allocation.
 *
 * @param instanceId The instance that received the bot.
 * @param worldId    The world the bot should join.
 * @param created    Whether a new instance had to be created.
 */
public record InstanceAllocation(long instanceId, String worldId, boolean created) {
}
