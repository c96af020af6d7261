package org.agentworld.runtime.instances;

/**
 * Kind of an instance, which determines its default capacity.
 */
public enum ChannelType {
    GENERAL(30),
    REGIONAL(30),
    EVENT(50),
    RESTRICTED(20),
    TEST(10);

    private final int defaultMaxBots;

    ChannelType(final int defaultMaxBots) {
        this.defaultMaxBots = defaultMaxBots;
    }

    public int getDefaultMaxBots() {
        return defaultMaxBots;
    }
}
