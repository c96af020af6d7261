package org.agentworld.runtime.recovery;

import java.util.List;

/**
 * Durable storage of the owner directory. Every change of the {@link OwnerDirectory} is written through.
 */
public interface IOwnerStore {

    /**
     * Stores the owner. Saving a known owner again has no effect.
     */
    void saveOwner(String ownerId);

    void deleteOwner(String ownerId);

    /**
     * @return The stored owners, sorted by id.
     */
    List<String> loadOwners();
}
