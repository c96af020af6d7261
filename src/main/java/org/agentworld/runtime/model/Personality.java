package org.agentworld.runtime.model;

/**
 * Archetype tag handed to the external decision policy of an agent.
 */
public enum Personality {
    CRIMINAL,
    GAMBLER,
    WORKER
}
