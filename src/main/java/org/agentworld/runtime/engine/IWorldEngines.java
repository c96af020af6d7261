package org.agentworld.runtime.engine;

import java.util.Collection;
import java.util.Optional;

/**
 * Lookup of the engines of all live worlds.
 */
public interface IWorldEngines {

    Collection<WorldEngine> allEngines();

    Optional<WorldEngine> findEngine(String worldId);
}
