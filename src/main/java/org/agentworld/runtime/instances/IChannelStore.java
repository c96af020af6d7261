package org.agentworld.runtime.instances;

import java.util.List;

/**
 * Durable storage of instances. Every change of the {@link InstanceManager} is written through.
 */
public interface IChannelStore {

    void saveInstance(Channel channel);

    List<Channel> loadInstances();
}
