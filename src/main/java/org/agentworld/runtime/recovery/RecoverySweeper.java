package org.agentworld.runtime.recovery;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.agentworld.runtime.command.CommandType;
import org.agentworld.runtime.engine.IWorldEngines;
import org.agentworld.runtime.engine.InputRecord;
import org.agentworld.runtime.engine.InputRejectedException;
import org.agentworld.runtime.engine.WorldEngine;
import org.agentworld.runtime.instances.Channel;
import org.agentworld.runtime.instances.IWorldDirectory;
import org.agentworld.runtime.instances.InstanceManager;
import org.agentworld.runtime.model.InProgressOperation;
import org.agentworld.runtime.store.SerializedWorld.SerializedAgent;
import org.agentworld.runtime.store.SerializedWorld.SerializedPlayer;
import org.agentworld.runtime.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Repairs state that got stuck or orphaned.
 * <p>
 * The sweeper never mutates a world directly. Stuck inputs are cleared through the engine's writer
 * lock; everything else is repaired by submitting ordinary inputs, so repairs are ordered with all
 * other inputs of the world. Running a pass twice in a row has no additional effect.
 */
public class RecoverySweeper {

    private static final Logger LOGGER = LoggerFactory.getLogger(RecoverySweeper.class);
    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    public static final String STUCK_INPUT_REASON = "cleared as stuck";

    private final IWorldEngines engines;
    private final IWorldDirectory worlds;
    private final InstanceManager instances;
    private final IOwnerDirectory owners;
    private final RecoverySettings settings;
    private final Clock clock;

    public RecoverySweeper(final IWorldEngines engines, final IWorldDirectory worlds, final InstanceManager instances,
                           final IOwnerDirectory owners, final RecoverySettings settings, final Clock clock) {
        this.engines = engines;
        this.worlds = worlds;
        this.instances = instances;
        this.owners = owners;
        this.settings = settings;
        this.clock = clock;
    }

    public RecoverySettings getSettings() {
        return settings;
    }

    /**
     * Fails pending inputs that have been waiting longer than their threshold.
     *
     * @param thresholdOverrideMs If not {@code null}, used for all inputs instead of the configured
     *                            per-command thresholds.
     */
    public SweepReport sweepStuckInputs(final Long thresholdOverrideMs) {
        final long startedAt = clock.millis();
        final List<String> affected = new ArrayList<>();
        for (final WorldEngine engine : engines.allEngines()) {
            final List<InputRecord> cleared = engine.clearStuckInputs(input -> {
                final long threshold = thresholdOverrideMs != null ? thresholdOverrideMs : settings.thresholdFor(input.name());
                return input.ageAt(startedAt) > threshold;
            }, STUCK_INPUT_REASON);
            for (final InputRecord input : cleared) {
                LOGGER.warn("[{}] Cleared stuck input #{} ({}) after {}ms", input.worldId(), input.number(),
                    input.name(), input.ageAt(startedAt));
                affected.add(input.worldId() + "#" + input.number());
            }
        }
        return new SweepReport("stuck-inputs", startedAt, affected);
    }

    /**
     * Submits {@code clearOperation} for every agent whose operation is older than the threshold.
     * The clear names the operation id, so it has no effect if the operation finished meanwhile.
     */
    public SweepReport sweepStuckOperations() {
        final long startedAt = clock.millis();
        final List<String> affected = new ArrayList<>();
        for (final WorldEngine engine : engines.allEngines()) {
            final Set<String> alreadyRequested = pendingTargets(engine, CommandType.CLEAR_OPERATION, "agentId");
            for (final SerializedAgent agent : engine.snapshot().state().agents()) {
                final InProgressOperation operation = agent.inProgressOperation();
                if (operation == null || operation.ageAt(startedAt) <= settings.stuckOperationThresholdMs()
                        || alreadyRequested.contains(agent.id())) {
                    continue;
                }
                final ObjectNode args = JSON.objectNode()
                    .put("agentId", agent.id())
                    .put("operationId", operation.operationId())
                    .put("reason", "operation " + operation.name() + " timed out after " + operation.ageAt(startedAt) + "ms");
                if (trySubmit(engine, CommandType.CLEAR_OPERATION, args)) {
                    LOGGER.warn("[{}] Requested clearing of stuck operation {} ({}) of agent {}", engine.getWorldId(),
                        operation.operationId(), operation.name(), agent.id());
                    affected.add(engine.getWorldId() + "/" + agent.id());
                }
            }
        }
        return new SweepReport("stuck-operations", startedAt, affected);
    }

    /**
     * Archives agents and players whose owner no longer exists and takes instances whose world is
     * gone out of rotation.
     */
    public SweepReport sweepOrphans() {
        final long startedAt = clock.millis();
        final List<String> affected = new ArrayList<>();
        for (final WorldEngine engine : engines.allEngines()) {
            final Set<String> pendingAgents = pendingTargets(engine, CommandType.ARCHIVE_AGENT, "agentId");
            final Set<String> pendingPlayers = pendingTargets(engine, CommandType.ARCHIVE_PLAYER, "playerId");
            final Set<String> playersOfOrphanAgents = new HashSet<>();

            for (final SerializedAgent agent : engine.snapshot().state().agents()) {
                if (agent.ownerId() == null || owners.isKnown(agent.ownerId())) {
                    continue;
                }
                playersOfOrphanAgents.add(agent.playerId());
                if (pendingAgents.contains(agent.id())) {
                    continue;
                }
                final String reason = "owner " + agent.ownerId() + " no longer exists";
                final ObjectNode args = JSON.objectNode().put("agentId", agent.id()).put("reason", reason);
                if (trySubmit(engine, CommandType.ARCHIVE_AGENT, args)) {
                    LOGGER.info("[{}] Archiving orphaned agent {}: {}", engine.getWorldId(), agent.id(), reason);
                    affected.add(engine.getWorldId() + "/" + agent.id());
                }
            }
            for (final SerializedPlayer player : engine.snapshot().state().players()) {
                if (player.ownerId() == null || owners.isKnown(player.ownerId())
                        || playersOfOrphanAgents.contains(player.id()) || pendingPlayers.contains(player.id())) {
                    continue;
                }
                final String reason = "owner " + player.ownerId() + " no longer exists";
                final ObjectNode args = JSON.objectNode().put("playerId", player.id()).put("reason", reason);
                if (trySubmit(engine, CommandType.ARCHIVE_PLAYER, args)) {
                    LOGGER.info("[{}] Archiving orphaned player {}: {}", engine.getWorldId(), player.id(), reason);
                    affected.add(engine.getWorldId() + "/" + player.id());
                }
            }
        }

        for (final Channel channel : instances.listInstances()) {
            if (channel.getWorldId() != null && !worlds.isWorldAlive(channel.getWorldId())) {
                instances.resetForReassignment(channel.getId());
                affected.add("instance/" + channel.getId());
            }
        }
        return new SweepReport("orphans", startedAt, affected);
    }

    /**
     * @return The values of {@code idField} of all pending inputs named like {@code type}.
     */
    private static Set<String> pendingTargets(final WorldEngine engine, final CommandType type, final String idField) {
        final Set<String> targets = new HashSet<>();
        for (final InputRecord input : engine.pendingInputs()) {
            if (input.name().equals(type.wireName()) && input.args() != null && input.args().hasNonNull(idField)) {
                targets.add(input.args().get(idField).asText());
            }
        }
        return targets;
    }

    private static boolean trySubmit(final WorldEngine engine, final CommandType type, final ObjectNode args) {
        try {
            engine.submit(type.wireName(), args);
            return true;
        } catch (final InputRejectedException | StoreException e) {
            LOGGER.warn("[{}] Could not submit {}: {}", engine.getWorldId(), type.wireName(), e.getMessage());
            return false;
        }
    }
}
