package org.agentworld.runtime.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.agentworld.runtime.ValidationException;
import org.agentworld.runtime.command.CommandParser;
import org.agentworld.runtime.command.WorldCommand;
import org.agentworld.runtime.model.World;
import org.agentworld.runtime.pathfinding.TileGrid;
import org.agentworld.runtime.store.IWorldStore;
import org.agentworld.runtime.store.SerializedWorld;
import org.agentworld.runtime.store.StepCommit;
import org.agentworld.runtime.store.StoreException;
import org.agentworld.runtime.store.StoredSnapshot;
import org.agentworld.runtime.store.WorldSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Owns one world: accepts inputs from any thread and applies them, one step at a time, on behalf
 * of a single writer.
 * <p>
 * <strong>Thread safety:</strong>
 * <ul>
 *   <li>{@link #submit} may be called concurrently. Number assignment, durable append and
 *       enqueueing happen under one lock, so input numbers reflect submission order.</li>
 *   <li>{@link #runStep} and {@link #clearStuckInputs} hold the writer lock. At most one of them
 *       mutates the world at any time.</li>
 *   <li>{@link #snapshot} never blocks; it returns the last published, immutable state.</li>
 * </ul>
 */
public class WorldEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorldEngine.class);

    private final String worldId;
    private final EngineSettings settings;
    private final IWorldStore store;
    private final Clock clock;
    private final CommandParser parser = new CommandParser();
    private final WorldSerializer serializer = new WorldSerializer();
    private final WorldCommandHandler handler;
    private final WorldTicker ticker;

    private final ReentrantLock writerLock = new ReentrantLock();
    private final Object queueLock = new Object();
    private final Deque<InputRecord> pending = new ArrayDeque<>();
    private long nextInputNumber;

    private World working;
    private long processedInputNumber;
    private long lastStepAt;
    private final Set<String> flaggedOperations = new HashSet<>();

    private final AtomicReference<WorldSnapshot> published = new AtomicReference<>();
    private final AtomicReference<List<StuckOperation>> stuckOperations = new AtomicReference<>(List.of());
    private final AtomicLong stepsCompleted = new AtomicLong(0);
    private final AtomicLong inputsApplied = new AtomicLong(0);
    private final AtomicLong inputsFailed = new AtomicLong(0);

    private WorldEngine(final World world, final long processedInputNumber, final List<InputRecord> pendingInputs,
                        final long lastInputNumber, final TileGrid grid, final EngineSettings settings,
                        final IWorldStore store, final Clock clock) {
        this.worldId = world.getWorldId();
        this.settings = settings;
        this.store = store;
        this.clock = clock;
        this.handler = new WorldCommandHandler(grid);
        this.ticker = new WorldTicker(grid, settings);
        this.working = world;
        this.processedInputNumber = processedInputNumber;
        this.pending.addAll(pendingInputs);
        this.nextInputNumber = lastInputNumber + 1;
        this.lastStepAt = clock.millis();
        publish(serializer.toSerialized(world), lastStepAt);
    }

    /**
     * Creates the engine of a new, empty world. The world must already be registered in the store.
     */
    public static WorldEngine create(final String worldId, final TileGrid grid, final EngineSettings settings,
                                     final IWorldStore store, final Clock clock) {
        return new WorldEngine(new World(worldId), 0, List.of(), store.lastInputNumber(worldId), grid, settings, store, clock);
    }

    /**
     * Rebuilds the engine of an existing world from its latest snapshot and re-enqueues its
     * pending inputs in number order.
     */
    public static WorldEngine restore(final String worldId, final TileGrid grid, final EngineSettings settings,
                                      final IWorldStore store, final Clock clock) {
        final Optional<StoredSnapshot> snapshot = store.loadSnapshot(worldId);
        final WorldSerializer serializer = new WorldSerializer();
        final World world = snapshot.map(s -> serializer.fromJson(s.json())).orElseGet(() -> new World(worldId));
        final long processed = snapshot.map(StoredSnapshot::processedInputNumber).orElse(0L);
        final List<InputRecord> pendingInputs = store.loadPendingInputs(worldId);
        LOGGER.debug("[{}] Restored at input #{} with {} pending inputs", worldId, processed, pendingInputs.size());
        return new WorldEngine(world, processed, pendingInputs, store.lastInputNumber(worldId), grid, settings, store, clock);
    }

    public String getWorldId() {
        return worldId;
    }

    /**
     * Validates and enqueues an input. Never blocks on the world's writer.
     *
     * @return The receipt carrying the input number.
     * @throws ValidationException     if the command name or its arguments are malformed.
     * @throws InputRejectedException  if too many inputs are already waiting.
     * @throws StoreException          if the input could not be appended to the log.
     */
    public InputReceipt submit(final String name, final JsonNode args) {
        final JsonNode payload = args == null || args.isNull() ? JsonNodeFactory.instance.objectNode() : args.deepCopy();
        parser.parse(name, payload);

        synchronized (queueLock) {
            if (pending.size() >= settings.maxPendingInputs()) {
                throw new InputRejectedException("World " + worldId + " has " + pending.size()
                    + " unprocessed inputs, try again later");
            }
            final InputRecord input = InputRecord.pending(worldId, nextInputNumber, name, payload, clock.millis());
            store.appendInput(input);
            nextInputNumber++;
            pending.addLast(input);
            return new InputReceipt(worldId, input.number(), input.receivedAt());
        }
    }

    /**
     * Runs one step: applies up to {@code maxInputsPerStep} pending inputs in number order, advances
     * the simulation, commits the result and publishes the new snapshot.
     *
     * @throws StoreException if the commit failed. Nothing is published in that case and the
     *                        inputs stay pending.
     */
    public StepResult runStep() {
        writerLock.lock();
        try {
            final long now = clock.millis();
            final List<InputRecord> batch = peekBatch();
            final List<InputRecord> completed = new ArrayList<>(batch.size());
            int applied = 0;
            int failed = 0;

            World next = working.copy();
            for (final InputRecord input : batch) {
                final World candidate = next.copy();
                InputOutcome outcome;
                try {
                    final WorldCommand command = parser.parse(input.name(), input.args());
                    final JsonNode value = handler.apply(candidate, command, now);
                    next = candidate;
                    outcome = InputOutcome.ok(value, now);
                    applied++;
                } catch (final ValidationException e) {
                    LOGGER.debug("[{}] Input #{} ({}) rejected: {}", worldId, input.number(), input.name(), e.getMessage());
                    outcome = InputOutcome.error(e.getMessage(), now);
                    failed++;
                } catch (final RuntimeException e) {
                    LOGGER.warn("[{}] Input #{} ({}) failed: {}", worldId, input.number(), input.name(), e.toString());
                    LOGGER.debug("Stack trace:", e);
                    outcome = InputOutcome.error(e.getClass().getSimpleName() + ": " + e.getMessage(), now);
                    failed++;
                }
                completed.add(input.withOutcome(outcome));
            }

            final long dt = Math.max(0, Math.min(now - lastStepAt, settings.maxStepDurationMs()));
            final List<StuckOperation> stuck = ticker.tick(next, now, dt);

            final long processed = batch.isEmpty() ? processedInputNumber : batch.get(batch.size() - 1).number();
            final SerializedWorld state = serializer.toSerialized(next);
            store.commitStep(new StepCommit(worldId, processed, serializer.writeJson(state), completed, now));

            working = next;
            processedInputNumber = processed;
            lastStepAt = now;
            synchronized (queueLock) {
                for (int i = 0; i < batch.size(); i++) {
                    pending.pollFirst();
                }
            }
            publish(state, now);
            flagStuckOperations(stuck);

            stepsCompleted.incrementAndGet();
            inputsApplied.addAndGet(applied);
            inputsFailed.addAndGet(failed);
            if (!batch.isEmpty()) {
                LOGGER.debug("[{}] Step processed inputs #{}..#{} ({} ok, {} failed)", worldId,
                    batch.get(0).number(), processed, applied, failed);
            }
            return new StepResult(worldId, applied, failed, processed, dt);
        } finally {
            writerLock.unlock();
        }
    }

    /**
     * Completes every pending input matching {@code isStuck} with an ERROR outcome.
     * Serialized with {@link #runStep}, so an input is never both processed and cleared.
     *
     * @return The inputs that were cleared by this call.
     */
    public List<InputRecord> clearStuckInputs(final Predicate<InputRecord> isStuck, final String reason) {
        writerLock.lock();
        try {
            final long now = clock.millis();
            final List<InputRecord> candidates;
            synchronized (queueLock) {
                candidates = pending.stream().filter(isStuck).toList();
            }
            final List<InputRecord> cleared = new ArrayList<>();
            final Set<Long> handled = new HashSet<>();
            for (final InputRecord input : candidates) {
                final InputOutcome outcome = InputOutcome.error(reason, now);
                if (store.completeInput(worldId, input.number(), outcome)) {
                    cleared.add(input.withOutcome(outcome));
                }
                handled.add(input.number());
            }
            synchronized (queueLock) {
                final Iterator<InputRecord> it = pending.iterator();
                while (it.hasNext()) {
                    if (handled.contains(it.next().number())) {
                        it.remove();
                    }
                }
            }
            return cleared;
        } finally {
            writerLock.unlock();
        }
    }

    public WorldSnapshot snapshot() {
        return published.get();
    }

    public List<StuckOperation> stuckOperations() {
        return stuckOperations.get();
    }

    public List<InputRecord> pendingInputs() {
        synchronized (queueLock) {
            return new ArrayList<>(pending);
        }
    }

    public int pendingCount() {
        synchronized (queueLock) {
            return pending.size();
        }
    }

    public Optional<InputRecord> findInput(final long inputNumber) {
        return store.findInput(worldId, inputNumber);
    }

    public long getStepsCompleted() {
        return stepsCompleted.get();
    }

    public long getInputsApplied() {
        return inputsApplied.get();
    }

    public long getInputsFailed() {
        return inputsFailed.get();
    }

    private List<InputRecord> peekBatch() {
        synchronized (queueLock) {
            final List<InputRecord> batch = new ArrayList<>(Math.min(pending.size(), settings.maxInputsPerStep()));
            final Iterator<InputRecord> it = pending.iterator();
            while (it.hasNext() && batch.size() < settings.maxInputsPerStep()) {
                batch.add(it.next());
            }
            return batch;
        }
    }

    private void publish(final SerializedWorld state, final long now) {
        published.set(new WorldSnapshot(worldId, processedInputNumber, now, state));
    }

    private void flagStuckOperations(final List<StuckOperation> stuck) {
        final Set<String> current = new HashSet<>();
        for (final StuckOperation s : stuck) {
            final String key = s.agentId() + "/" + s.operation().operationId();
            current.add(key);
            if (flaggedOperations.add(key)) {
                LOGGER.warn("[{}] Agent {} is stuck in operation {} ({}) for {}ms", worldId, s.agentId(),
                    s.operation().operationId(), s.operation().name(), s.age());
            }
        }
        flaggedOperations.retainAll(current);
        stuckOperations.set(List.copyOf(stuck));
    }
}
