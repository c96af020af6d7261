package org.agentworld.runtime.store;

import org.agentworld.runtime.engine.InputOutcome;
import org.agentworld.runtime.engine.InputRecord;
import org.agentworld.runtime.instances.Channel;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Volatile {@link IWorldStore} for tests and single-process setups without persistence.
 * All operations are serialized on the store instance.
 */
public class InMemoryWorldStore implements IWorldStore {

    private final Map<String, WorldRecord> worlds = new LinkedHashMap<>();
    private final Map<String, NavigableMap<Long, InputRecord>> inputs = new HashMap<>();
    private final Map<String, StoredSnapshot> snapshots = new HashMap<>();
    private final Map<Long, Channel> instances = new LinkedHashMap<>();
    private final Set<String> owners = new TreeSet<>();

    @Override
    public synchronized void createWorld(final WorldRecord world) {
        if (worlds.putIfAbsent(world.worldId(), world) != null) {
            throw new StoreException("World " + world.worldId() + " already exists");
        }
    }

    @Override
    public synchronized List<WorldRecord> listWorlds() {
        return new ArrayList<>(worlds.values());
    }

    @Override
    public synchronized void appendInput(final InputRecord input) {
        final NavigableMap<Long, InputRecord> log = inputs.computeIfAbsent(input.worldId(), id -> new TreeMap<>());
        if (log.containsKey(input.number())) {
            throw new StoreException("Input " + input.worldId() + "#" + input.number() + " already exists");
        }
        log.put(input.number(), input);
    }

    @Override
    public synchronized void commitStep(final StepCommit commit) {
        final NavigableMap<Long, InputRecord> log = inputs.computeIfAbsent(commit.worldId(), id -> new TreeMap<>());
        for (final InputRecord completed : commit.completedInputs()) {
            if (!log.containsKey(completed.number())) {
                throw new StoreException("Input " + commit.worldId() + "#" + completed.number() + " is not in the log");
            }
        }
        for (final InputRecord completed : commit.completedInputs()) {
            final InputRecord current = log.get(completed.number());
            if (current.isPending()) {
                log.put(completed.number(), current.withOutcome(completed.outcome()));
            }
        }
        snapshots.put(commit.worldId(),
            new StoredSnapshot(commit.worldId(), commit.processedInputNumber(), commit.snapshotJson(), commit.savedAt()));
    }

    @Override
    public synchronized boolean completeInput(final String worldId, final long inputNumber, final InputOutcome outcome) {
        final NavigableMap<Long, InputRecord> log = inputs.get(worldId);
        final InputRecord current = log != null ? log.get(inputNumber) : null;
        if (current == null || !current.isPending()) {
            return false;
        }
        log.put(inputNumber, current.withOutcome(outcome));
        return true;
    }

    @Override
    public synchronized Optional<InputRecord> findInput(final String worldId, final long inputNumber) {
        final NavigableMap<Long, InputRecord> log = inputs.get(worldId);
        return log == null ? Optional.empty() : Optional.ofNullable(log.get(inputNumber));
    }

    @Override
    public synchronized List<InputRecord> loadPendingInputs(final String worldId) {
        final List<InputRecord> pending = new ArrayList<>();
        final NavigableMap<Long, InputRecord> log = inputs.get(worldId);
        if (log != null) {
            log.values().stream().filter(InputRecord::isPending).forEach(pending::add);
        }
        return pending;
    }

    @Override
    public synchronized long lastInputNumber(final String worldId) {
        final NavigableMap<Long, InputRecord> log = inputs.get(worldId);
        return log == null || log.isEmpty() ? 0 : log.lastKey();
    }

    @Override
    public synchronized Optional<StoredSnapshot> loadSnapshot(final String worldId) {
        return Optional.ofNullable(snapshots.get(worldId));
    }

    @Override
    public synchronized void saveInstance(final Channel channel) {
        instances.put(channel.getId(), channel.copy());
    }

    @Override
    public synchronized List<Channel> loadInstances() {
        final List<Channel> copies = new ArrayList<>();
        instances.values().forEach(c -> copies.add(c.copy()));
        return copies;
    }

    @Override
    public synchronized void saveOwner(final String ownerId) {
        owners.add(ownerId);
    }

    @Override
    public synchronized void deleteOwner(final String ownerId) {
        owners.remove(ownerId);
    }

    @Override
    public synchronized List<String> loadOwners() {
        return List.copyOf(owners);
    }

    @Override
    public void close() {
        // nothing to release
    }
}
