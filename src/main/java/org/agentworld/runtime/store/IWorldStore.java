package org.agentworld.runtime.store;

import org.agentworld.runtime.engine.InputOutcome;
import org.agentworld.runtime.engine.InputRecord;
import org.agentworld.runtime.instances.IChannelStore;
import org.agentworld.runtime.recovery.IOwnerStore;

import java.util.List;
import java.util.Optional;

/**
 * Durable state of all worlds: the append-only input log per world, the latest snapshot per world
 * the instance table and the owner directory.
 * <p>
 * Outcomes are write-once. Writing an outcome for an input that already has one is silently
 * ignored, which makes repair operations idempotent.
 * <p>
 * Failing operations throw {@link StoreException} and leave the store unchanged.
 */
public interface IWorldStore extends IChannelStore, IOwnerStore, AutoCloseable {

    void createWorld(WorldRecord world);

    List<WorldRecord> listWorlds();

    /**
     * Appends a pending input to the log of its world.
     *
     * @throws StoreException if an input with the same number already exists.
     */
    void appendInput(InputRecord input);

    /**
     * Atomically stores the snapshot and the outcomes of one step.
     */
    void commitStep(StepCommit commit);

    /**
     * Sets the outcome of a pending input.
     *
     * @return {@code false} if the input is unknown or already has an outcome.
     */
    boolean completeInput(String worldId, long inputNumber, InputOutcome outcome);

    Optional<InputRecord> findInput(String worldId, long inputNumber);

    /**
     * @return The pending inputs of the world in number order.
     */
    List<InputRecord> loadPendingInputs(String worldId);

    /**
     * @return The highest input number ever assigned in the world, 0 if none.
     */
    long lastInputNumber(String worldId);

    Optional<StoredSnapshot> loadSnapshot(String worldId);

    @Override
    void close();
}
