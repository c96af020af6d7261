package org.agentworld.runtime.engine;

import org.agentworld.runtime.model.Agent;
import org.agentworld.runtime.model.Conversation;
import org.agentworld.runtime.model.Facing;
import org.agentworld.runtime.model.InProgressOperation;
import org.agentworld.runtime.model.PathState;
import org.agentworld.runtime.model.Pathfinding;
import org.agentworld.runtime.model.Player;
import org.agentworld.runtime.model.Position;
import org.agentworld.runtime.model.World;
import org.agentworld.runtime.pathfinding.PathResult;
import org.agentworld.runtime.pathfinding.Pathfinder;
import org.agentworld.runtime.pathfinding.Tile;
import org.agentworld.runtime.pathfinding.TileGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * The continuous part of a step: everything that changes with time rather than with inputs.
 * <ol>
 *   <li>expire finished activities</li>
 *   <li>plan routes for players that requested movement</li>
 *   <li>move players along their routes</li>
 *   <li>drop dangling conversation members and archive finished conversations</li>
 *   <li>detect agent operations that exceed the operation timeout</li>
 * </ol>
 */
public final class WorldTicker {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorldTicker.class);
    private static final double EPSILON = 1e-9;

    private final TileGrid grid;
    private final EngineSettings settings;

    public WorldTicker(final TileGrid grid, final EngineSettings settings) {
        this.grid = grid;
        this.settings = settings;
    }

    /**
     * Advances the world by {@code dtMs} of simulated time.
     *
     * @return The agents whose in-progress operation is older than the operation timeout.
     */
    public List<StuckOperation> tick(final World world, final long now, final long dtMs) {
        expireActivities(world, now);
        planRoutes(world, now);
        move(world, dtMs);
        settleConversations(world, now);
        return findStuckOperations(world, now);
    }

    private void expireActivities(final World world, final long now) {
        for (final Player player : world.getPlayers()) {
            if (player.getActivity() != null && !player.getActivity().isOngoing(now)) {
                player.setActivity(null);
            }
        }
    }

    private void planRoutes(final World world, final long now) {
        for (final Player player : world.getPlayers()) {
            final Pathfinding pathfinding = player.getPathfinding();
            if (pathfinding == null) {
                continue;
            }
            if (now - pathfinding.started() > settings.pathfindingTimeoutMs()) {
                LOGGER.debug("[{}] Player {} gave up moving to {} after {}ms", world.getWorldId(), player.getId(),
                    pathfinding.destination(), now - pathfinding.started());
                player.stop();
                continue;
            }
            if (pathfinding.state() != PathState.NEEDS_PATH) {
                continue;
            }
            final Set<Tile> blocked = WorldCommandHandler.occupiedTiles(world, player.getId());
            final PathResult route = Pathfinder.findPath(grid, blocked, player.getPosition().toTile(), pathfinding.destination());
            if (!route.isFound()) {
                LOGGER.debug("[{}] No path for player {} to {}", world.getWorldId(), player.getId(), pathfinding.destination());
                player.stop();
                continue;
            }
            player.setPathfinding(pathfinding.moving(route.getWaypoints()));
            player.setSpeed(settings.movementSpeed());
        }
    }

    private void move(final World world, final long dtMs) {
        if (dtMs <= 0) {
            return;
        }
        for (final Player player : world.getPlayers()) {
            final Pathfinding pathfinding = player.getPathfinding();
            if (pathfinding == null || pathfinding.state() != PathState.MOVING) {
                continue;
            }
            double budget = player.getSpeed() * dtMs / 1000.0;
            Position position = player.getPosition();
            int next = pathfinding.nextWaypoint();
            final List<Tile> waypoints = pathfinding.waypoints();
            while (budget > EPSILON && next < waypoints.size()) {
                final Tile waypoint = waypoints.get(next);
                if (!waypoint.equals(position.toTile()) && isOccupiedByOther(world, player, waypoint)) {
                    // someone stepped into our route; plan again next step
                    player.setPathfinding(Pathfinding.requested(pathfinding.destination(), pathfinding.started()));
                    break;
                }
                final Position target = Position.of(waypoint);
                final double distance = position.distanceTo(target);
                player.setFacing(Facing.towards(position, target, player.getFacing()));
                if (distance <= budget) {
                    position = target;
                    budget -= distance;
                    next++;
                } else {
                    final double fraction = budget / distance;
                    position = new Position(position.x() + (target.x() - position.x()) * fraction,
                        position.y() + (target.y() - position.y()) * fraction);
                    budget = 0;
                }
            }
            player.setPosition(position);
            if (player.getPathfinding() != null && player.getPathfinding().state() == PathState.MOVING) {
                if (next >= waypoints.size()) {
                    player.stop();
                } else {
                    player.setPathfinding(pathfinding.advancedTo(next));
                }
            }
        }
    }

    private static boolean isOccupiedByOther(final World world, final Player mover, final Tile tile) {
        for (final Player other : world.getPlayers()) {
            if (other != mover && other.getPosition().toTile().equals(tile)) {
                return true;
            }
        }
        return false;
    }

    private static void settleConversations(final World world, final long now) {
        final List<String> finished = new ArrayList<>();
        for (final Conversation conversation : world.getConversations()) {
            if (!conversation.isFinished()) {
                for (final String participant : List.copyOf(conversation.getParticipants())) {
                    if (world.findPlayer(participant).isEmpty()) {
                        conversation.removeParticipant(participant, now);
                    }
                }
                if (conversation.getInvitee() != null && world.findPlayer(conversation.getInvitee()).isEmpty()) {
                    conversation.finish(now);
                }
            }
            if (conversation.isFinished()) {
                finished.add(conversation.getId());
            }
        }
        for (final String conversationId : finished) {
            world.archiveConversation(conversationId, now, "finished");
        }
    }

    private List<StuckOperation> findStuckOperations(final World world, final long now) {
        final List<StuckOperation> stuck = new ArrayList<>();
        for (final Agent agent : world.getAgents()) {
            final InProgressOperation operation = agent.getInProgressOperation();
            if (operation != null && operation.ageAt(now) > settings.operationTimeoutMs()) {
                stuck.add(new StuckOperation(world.getWorldId(), agent.getId(), agent.getPlayerId(), operation, operation.ageAt(now)));
            }
        }
        return stuck;
    }
}
