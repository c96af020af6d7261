package org.agentworld.runtime.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.agentworld.runtime.ValidationException;
import org.agentworld.runtime.command.WorldCommand;
import org.agentworld.runtime.conversation.ConversationStateMachine;
import org.agentworld.runtime.model.Activity;
import org.agentworld.runtime.model.Agent;
import org.agentworld.runtime.model.Conversation;
import org.agentworld.runtime.model.Facing;
import org.agentworld.runtime.model.InProgressOperation;
import org.agentworld.runtime.model.Pathfinding;
import org.agentworld.runtime.model.Player;
import org.agentworld.runtime.model.Position;
import org.agentworld.runtime.model.World;
import org.agentworld.runtime.pathfinding.Tile;
import org.agentworld.runtime.pathfinding.TileGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Set;

/**
 * Applies one {@link WorldCommand} to a {@link World}.
 * <p>
 * The handler mutates the world it is given. The engine always hands it a private copy and throws
 * the copy away when the handler fails, so a command either applies completely or not at all.
 * Handlers validate everything they can before mutating, but they do not have to.
 */
public final class WorldCommandHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorldCommandHandler.class);
    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private final TileGrid grid;
    private final ConversationStateMachine conversations;

    public WorldCommandHandler(final TileGrid grid) {
        this(grid, new ConversationStateMachine());
    }

    public WorldCommandHandler(final TileGrid grid, final ConversationStateMachine conversations) {
        this.grid = grid;
        this.conversations = conversations;
    }

    /**
     * Applies the command.
     *
     * @param world   The world to mutate.
     * @param command The command to apply.
     * @param now     Epoch millis of the step that processes the command.
     * @return The command's result value; an empty object for commands without a result.
     * @throws ValidationException if the command references unknown or invalid state.
     */
    public JsonNode apply(final World world, final WorldCommand command, final long now) {
        return switch (command.type()) {
            case JOIN -> join(world, (WorldCommand.Join) command, now);
            case LEAVE -> leave(world, (WorldCommand.Leave) command, now);
            case MOVE_TO -> moveTo(world, (WorldCommand.MoveTo) command, now);
            case SET_ACTIVITY -> setActivity(world, (WorldCommand.SetActivity) command, now);
            case CREATE_AGENT -> createAgent(world, (WorldCommand.CreateAgent) command, now);
            case START_OPERATION -> startOperation(world, (WorldCommand.StartOperation) command, now);
            case FINISH_OPERATION -> finishOperation(world, (WorldCommand.FinishOperation) command, now);
            case CLEAR_OPERATION -> clearOperation(world, (WorldCommand.ClearOperation) command);
            case ARCHIVE_AGENT -> archiveAgent(world, (WorldCommand.ArchiveAgent) command, now);
            case ARCHIVE_PLAYER -> archivePlayer(world, (WorldCommand.ArchivePlayer) command, now);
            case START_CONVERSATION -> startConversation(world, (WorldCommand.StartConversation) command, now);
            case ACCEPT_INVITE -> {
                final WorldCommand.AcceptInvite accept = (WorldCommand.AcceptInvite) command;
                conversations.accept(world, accept.playerId(), accept.conversationId());
                yield empty();
            }
            case REJECT_INVITE -> {
                final WorldCommand.RejectInvite reject = (WorldCommand.RejectInvite) command;
                conversations.reject(world, reject.playerId(), reject.conversationId(), now);
                yield empty();
            }
            case SET_TYPING -> {
                final WorldCommand.SetTyping typing = (WorldCommand.SetTyping) command;
                conversations.setTyping(world, typing.playerId(), typing.conversationId(), typing.typing());
                yield empty();
            }
            case SEND_MESSAGE -> {
                final WorldCommand.SendMessage message = (WorldCommand.SendMessage) command;
                conversations.sendMessage(world, message.playerId(), message.conversationId(), message.text(), now);
                touch(world, message.playerId(), now);
                yield empty();
            }
            case LEAVE_CONVERSATION -> {
                final WorldCommand.LeaveConversation leave = (WorldCommand.LeaveConversation) command;
                conversations.leave(world, leave.playerId(), leave.conversationId(), now);
                yield empty();
            }
            case FINISH_CONVERSATION -> {
                final WorldCommand.FinishConversation finish = (WorldCommand.FinishConversation) command;
                conversations.finish(world, finish.playerId(), finish.conversationId(), now);
                yield empty();
            }
        };
    }

    private JsonNode join(final World world, final WorldCommand.Join join, final long now) {
        final Player player = spawnPlayer(world, join.name(), join.ownerId(), join.zone(), join.position(), now);
        LOGGER.debug("[{}] Player {} ({}) joined at {}", world.getWorldId(), player.getId(), player.getName(), player.getPosition());
        return JSON.objectNode().put("playerId", player.getId());
    }

    private JsonNode leave(final World world, final WorldCommand.Leave leave, final long now) {
        requirePlayer(world, leave.playerId());
        removePlayer(world, leave.playerId(), now, "left the world");
        return empty();
    }

    private JsonNode moveTo(final World world, final WorldCommand.MoveTo move, final long now) {
        final Player player = requirePlayer(world, move.playerId());
        if (move.destination() == null) {
            player.stop();
        } else {
            final Tile destination = move.destination();
            if (!grid.isWalkable(destination, Set.of())) {
                throw new ValidationException("Invalid destination " + destination);
            }
            player.setPathfinding(Pathfinding.requested(destination, now));
        }
        player.setLastInput(now);
        return empty();
    }

    private JsonNode setActivity(final World world, final WorldCommand.SetActivity command, final long now) {
        final Player player = requirePlayer(world, command.playerId());
        if (command.description() == null) {
            player.setActivity(null);
        } else {
            player.setActivity(new Activity(command.description(), command.emoji(),
                activityUntil(now, command.durationMs())));
        }
        player.setLastInput(now);
        return empty();
    }

    private JsonNode createAgent(final World world, final WorldCommand.CreateAgent command, final long now) {
        final Player player = spawnPlayer(world, command.name(), command.ownerId(), command.zone(), command.position(), now);
        final Agent agent = new Agent(world.allocateId(World.AGENT_PREFIX), player.getId(), command.personality(), command.ownerId());
        world.addAgent(agent);
        LOGGER.debug("[{}] Agent {} created for player {} ({})", world.getWorldId(), agent.getId(), player.getId(), command.personality());
        final ObjectNode result = JSON.objectNode();
        result.put("agentId", agent.getId());
        result.put("playerId", player.getId());
        return result;
    }

    private JsonNode startOperation(final World world, final WorldCommand.StartOperation command, final long now) {
        final Agent agent = requireAgent(world, command.agentId());
        final InProgressOperation current = agent.getInProgressOperation();
        if (current != null) {
            throw new ValidationException("Agent " + agent.getId() + " already has operation "
                + current.operationId() + " (" + current.name() + ") in progress");
        }
        agent.setInProgressOperation(new InProgressOperation(command.name(), command.operationId(), now));
        return empty();
    }

    private JsonNode finishOperation(final World world, final WorldCommand.FinishOperation command, final long now) {
        final Agent agent = requireAgent(world, command.agentId());
        final InProgressOperation current = agent.getInProgressOperation();
        if (current == null || !current.operationId().equals(command.operationId())) {
            // the operation was cleared or superseded in the meantime
            LOGGER.debug("[{}] Agent {} ignores result of operation {} (current: {})", world.getWorldId(),
                agent.getId(), command.operationId(), current != null ? current.operationId() : null);
            return JSON.objectNode().put("applied", false);
        }
        agent.setInProgressOperation(null);

        final Player player = requirePlayer(world, agent.getPlayerId());
        if (command.invitee() != null) {
            player.stop();
            final Conversation conversation = conversations.start(world, player.getId(), command.invitee(), now);
            agent.setLastInviteAttempt(now);
            return JSON.objectNode().put("applied", true).put("conversationId", conversation.getId());
        }
        if (command.destination() != null) {
            if (!grid.isWalkable(command.destination(), Set.of())) {
                throw new ValidationException("Invalid destination " + command.destination());
            }
            player.setPathfinding(Pathfinding.requested(command.destination(), now));
        } else if (command.activity() != null && command.activity().description() != null) {
            if (command.activity().durationMs() <= 0) {
                throw new ValidationException("durationMs must be positive");
            }
            player.setActivity(new Activity(command.activity().description(), command.activity().emoji(),
                activityUntil(now, command.activity().durationMs())));
        }
        return JSON.objectNode().put("applied", true);
    }

    private JsonNode clearOperation(final World world, final WorldCommand.ClearOperation command) {
        final Agent agent = requireAgent(world, command.agentId());
        final InProgressOperation current = agent.getInProgressOperation();
        if (current == null || (command.operationId() != null && !command.operationId().equals(current.operationId()))) {
            return JSON.objectNode().put("cleared", false);
        }
        agent.setInProgressOperation(null);
        LOGGER.info("[{}] Cleared operation {} ({}) of agent {}: {}", world.getWorldId(), current.operationId(),
            current.name(), agent.getId(), command.reason() != null ? command.reason() : "no reason given");
        return JSON.objectNode().put("cleared", true);
    }

    private JsonNode archiveAgent(final World world, final WorldCommand.ArchiveAgent command, final long now) {
        final Agent agent = requireAgent(world, command.agentId());
        final String reason = command.reason() != null ? command.reason() : "archived";
        removePlayer(world, agent.getPlayerId(), now, reason);
        LOGGER.info("[{}] Archived agent {} and player {}: {}", world.getWorldId(), agent.getId(), agent.getPlayerId(), reason);
        return empty();
    }

    private JsonNode archivePlayer(final World world, final WorldCommand.ArchivePlayer command, final long now) {
        requirePlayer(world, command.playerId());
        final String reason = command.reason() != null ? command.reason() : "archived";
        removePlayer(world, command.playerId(), now, reason);
        LOGGER.info("[{}] Archived player {}: {}", world.getWorldId(), command.playerId(), reason);
        return empty();
    }

    private JsonNode startConversation(final World world, final WorldCommand.StartConversation command, final long now) {
        final Conversation conversation = conversations.start(world, command.playerId(), command.inviteeId(), now);
        touch(world, command.playerId(), now);
        return JSON.objectNode().put("conversationId", conversation.getId());
    }

    /**
     * Takes the player out of its conversation, archives its agent (if any) and then the player.
     */
    private void removePlayer(final World world, final String playerId, final long now, final String reason) {
        conversations.withdraw(world, playerId, now);
        world.findAgentByPlayer(playerId).ifPresent(agent -> world.archiveAgent(agent.getId(), now, reason));
        world.archivePlayer(playerId, now, reason);
    }

    private Player spawnPlayer(final World world, final String name, final String ownerId, final String zone,
                               final Tile requested, final long now) {
        final Set<Tile> occupied = occupiedTiles(world, null);
        final Tile tile;
        if (requested != null) {
            if (!grid.isWalkable(requested, occupied)) {
                throw new ValidationException("Position " + requested + " is not free");
            }
            tile = requested;
        } else {
            tile = findFreeTile(occupied);
        }
        final Player player = new Player(world.allocateId(World.PLAYER_PREFIX), name, ownerId, Position.of(tile),
            Facing.DOWN, zone, now);
        world.addPlayer(player);
        return player;
    }

    /**
     * Scans the grid row by row and returns the first walkable, unoccupied tile.
     */
    private Tile findFreeTile(final Set<Tile> occupied) {
        for (int y = 0; y < grid.getHeight(); y++) {
            for (int x = 0; x < grid.getWidth(); x++) {
                final Tile tile = new Tile(x, y);
                if (grid.isWalkable(tile, occupied)) {
                    return tile;
                }
            }
        }
        throw new ValidationException("Failed to find a free position");
    }

    /**
     * @return The tiles currently covered by players, except the one with {@code excludedPlayerId}.
     */
    static Set<Tile> occupiedTiles(final World world, final String excludedPlayerId) {
        final Set<Tile> occupied = new HashSet<>();
        for (final Player p : world.getPlayers()) {
            if (!p.getId().equals(excludedPlayerId)) {
                occupied.add(p.getPosition().toTile());
            }
        }
        return occupied;
    }

    private static long activityUntil(final long now, final long durationMs) {
        try {
            return Math.addExact(now, durationMs);
        } catch (final ArithmeticException e) {
            throw new ValidationException("durationMs " + durationMs + " is too large");
        }
    }

    private static Player requirePlayer(final World world, final String playerId) {
        return world.findPlayer(playerId)
            .orElseThrow(() -> new ValidationException("Invalid player ID " + playerId));
    }

    private static Agent requireAgent(final World world, final String agentId) {
        return world.findAgent(agentId)
            .orElseThrow(() -> new ValidationException("Invalid agent ID " + agentId));
    }

    private static void touch(final World world, final String playerId, final long now) {
        world.findPlayer(playerId).ifPresent(p -> p.setLastInput(now));
    }

    private static ObjectNode empty() {
        return JSON.objectNode();
    }
}
