package org.agentworld.runtime.recovery;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * The owners known to this node, written through to an {@link IOwnerStore} so that they survive
 * restarts together with the worlds whose entities reference them.
 * <p>
 * The in-memory set changes only after the store accepted the change.
 */
public class OwnerDirectory implements IOwnerDirectory {

    private final IOwnerStore store;
    private final Set<String> owners = new TreeSet<>();

    /**
     * Loads the stored owners and registers {@code configuredOwners} on top of them.
     */
    public OwnerDirectory(final IOwnerStore store, final Collection<String> configuredOwners) {
        this.store = store;
        owners.addAll(store.loadOwners());
        configuredOwners.forEach(this::register);
    }

    /**
     * @return {@code true} if the owner was not registered before.
     */
    public synchronized boolean register(final String ownerId) {
        if (owners.contains(ownerId)) {
            return false;
        }
        store.saveOwner(ownerId);
        owners.add(ownerId);
        return true;
    }

    /**
     * @return {@code true} if the owner was registered.
     */
    public synchronized boolean remove(final String ownerId) {
        if (!owners.contains(ownerId)) {
            return false;
        }
        store.deleteOwner(ownerId);
        owners.remove(ownerId);
        return true;
    }

    @Override
    public synchronized boolean isKnown(final String ownerId) {
        return owners.contains(ownerId);
    }

    public synchronized List<String> listOwners() {
        return List.copyOf(owners);
    }
}
