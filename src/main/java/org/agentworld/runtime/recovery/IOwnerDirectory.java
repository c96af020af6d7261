package org.agentworld.runtime.recovery;

/**
 * Knows which external owners (bot deployments, accounts) still exist.
 */
public interface IOwnerDirectory {

    boolean isKnown(String ownerId);
}
