package org.agentworld.runtime.instances;

/**
 * Creates worlds and answers whether a world still exists.
 */
public interface IWorldDirectory {

    /**
     * Creates a fresh, empty world.
     *
     * @return The id of the new world.
     */
    String createWorld();

    /**
     * @return {@code true} if the world exists and is being stepped.
     */
    boolean isWorldAlive(String worldId);
}
