package org.agentworld.runtime.instances;

import java.util.List;

/**
 * Health of one instance as seen by {@link InstanceManager#healthReport()}.
 */
public record ChannelHealth(
    long instanceId,
    String name,
    String zoneType,
    ChannelStatus status,
    String worldId,
    int currentBots,
    int maxBots,
    double loadPercent,
    boolean healthy,
    List<String> issues,
    List<HealthRecommendation> recommendations
) {
}
