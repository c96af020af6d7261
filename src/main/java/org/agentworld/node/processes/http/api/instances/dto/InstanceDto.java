package org.agentworld.node.processes.http.api.instances.dto;

import org.agentworld.runtime.instances.Channel;
import org.agentworld.runtime.instances.ChannelStatus;
import org.agentworld.runtime.instances.ChannelType;

public record InstanceDto(
    long id,
    String name,
    String zoneType,
    ChannelType type,
    ChannelStatus status,
    String worldId,
    int currentBots,
    int maxBots,
    double loadPercent,
    boolean defaultInstance,
    boolean needsWorldReassignment,
    Long overCapacityUntil
) {
    public static InstanceDto from(final Channel channel) {
        return new InstanceDto(channel.getId(), channel.getName(), channel.getZoneType(), channel.getType(),
            channel.getStatus(), channel.getWorldId(), channel.getCurrentBots(), channel.getMaxBots(),
            channel.getLoadPercent(), channel.isDefaultInstance(), channel.isNeedsWorldReassignment(),
            channel.getOverCapacityUntil());
    }
}
