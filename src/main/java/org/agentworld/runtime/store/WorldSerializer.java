package org.agentworld.runtime.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.agentworld.runtime.model.Agent;
import org.agentworld.runtime.model.ArchiveEntry;
import org.agentworld.runtime.model.Conversation;
import org.agentworld.runtime.model.Player;
import org.agentworld.runtime.model.World;
import org.agentworld.runtime.store.SerializedWorld.SerializedAgent;
import org.agentworld.runtime.store.SerializedWorld.SerializedArchiveEntry;
import org.agentworld.runtime.store.SerializedWorld.SerializedConversation;
import org.agentworld.runtime.store.SerializedWorld.SerializedPlayer;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.TreeSet;

/**
 * Converts worlds to and from their JSON snapshot form.
 */
public final class WorldSerializer {

    private final ObjectMapper mapper;

    public WorldSerializer() {
        this(new ObjectMapper());
    }

    public WorldSerializer(final ObjectMapper mapper) {
        this.mapper = mapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public SerializedWorld toSerialized(final World world) {
        final List<SerializedPlayer> players = new ArrayList<>();
        world.getPlayers().forEach(p -> players.add(toSerialized(p)));
        final List<SerializedAgent> agents = new ArrayList<>();
        world.getAgents().forEach(a -> agents.add(toSerialized(a)));
        final List<SerializedConversation> conversations = new ArrayList<>();
        world.getConversations().forEach(c -> conversations.add(toSerialized(c)));

        final List<SerializedArchiveEntry<SerializedPlayer>> archivedPlayers = new ArrayList<>();
        for (final ArchiveEntry<Player> entry : world.getArchivedPlayers().values()) {
            archivedPlayers.add(new SerializedArchiveEntry<>(toSerialized(entry.entity()), entry.archivedAt(), entry.reason()));
        }
        final List<SerializedArchiveEntry<SerializedAgent>> archivedAgents = new ArrayList<>();
        for (final ArchiveEntry<Agent> entry : world.getArchivedAgents().values()) {
            archivedAgents.add(new SerializedArchiveEntry<>(toSerialized(entry.entity()), entry.archivedAt(), entry.reason()));
        }
        final List<SerializedArchiveEntry<SerializedConversation>> archivedConversations = new ArrayList<>();
        for (final ArchiveEntry<Conversation> entry : world.getArchivedConversations().values()) {
            archivedConversations.add(new SerializedArchiveEntry<>(toSerialized(entry.entity()), entry.archivedAt(), entry.reason()));
        }
        return new SerializedWorld(world.getWorldId(), world.getNextId(), players, agents, conversations,
            archivedPlayers, archivedAgents, archivedConversations);
    }

    public World fromSerialized(final SerializedWorld serialized) {
        final World world = new World(serialized.worldId(), serialized.nextId());
        // archived entities first so that id reuse is detected while restoring live ones
        for (final SerializedArchiveEntry<SerializedPlayer> e : serialized.archivedPlayers()) {
            world.restoreArchivedPlayer(new ArchiveEntry<>(toPlayer(e.entity()), e.archivedAt(), e.reason()));
        }
        for (final SerializedArchiveEntry<SerializedAgent> e : serialized.archivedAgents()) {
            world.restoreArchivedAgent(new ArchiveEntry<>(toAgent(e.entity()), e.archivedAt(), e.reason()));
        }
        for (final SerializedArchiveEntry<SerializedConversation> e : serialized.archivedConversations()) {
            world.restoreArchivedConversation(new ArchiveEntry<>(toConversation(e.entity()), e.archivedAt(), e.reason()));
        }
        for (final SerializedPlayer p : serialized.players()) {
            world.addPlayer(toPlayer(p));
        }
        for (final SerializedAgent a : serialized.agents()) {
            world.addAgent(toAgent(a));
        }
        for (final SerializedConversation c : serialized.conversations()) {
            world.addConversation(toConversation(c));
        }
        return world;
    }

    public String toJson(final World world) {
        return writeJson(toSerialized(world));
    }

    public String writeJson(final SerializedWorld serialized) {
        try {
            return mapper.writeValueAsString(serialized);
        } catch (final JsonProcessingException e) {
            throw new StoreException("Failed to serialize world " + serialized.worldId(), e);
        }
    }

    public SerializedWorld readJson(final String json) {
        try {
            return mapper.readValue(json, SerializedWorld.class);
        } catch (final JsonProcessingException e) {
            throw new StoreException("Failed to parse world snapshot: " + e.getOriginalMessage(), e);
        }
    }

    public World fromJson(final String json) {
        return fromSerialized(readJson(json));
    }

    private static SerializedPlayer toSerialized(final Player p) {
        return new SerializedPlayer(p.getId(), p.getName(), p.getOwnerId(), p.getPosition(), p.getFacing(),
            p.getSpeed(), p.getPathfinding(), p.getActivity(), p.getZone(), p.getLastInput());
    }

    private static SerializedAgent toSerialized(final Agent a) {
        return new SerializedAgent(a.getId(), a.getPlayerId(), a.getPersonality(), a.getOwnerId(),
            a.getInProgressOperation(), a.getLastInviteAttempt());
    }

    private static SerializedConversation toSerialized(final Conversation c) {
        return new SerializedConversation(c.getId(), c.getCreator(), c.getCreated(),
            new ArrayList<>(new TreeSet<>(c.getParticipants())), c.getInvitee(), c.getLastMessage(),
            c.getNumMessages(), new ArrayList<>(new TreeSet<>(c.getTyping())), c.isFinished(), c.getFinishedAt());
    }

    private static Player toPlayer(final SerializedPlayer p) {
        final Player player = new Player(p.id(), p.name(), p.ownerId(), p.position(), p.facing(), p.zone(), p.lastInput());
        player.setSpeed(p.speed());
        player.setPathfinding(p.pathfinding());
        player.setActivity(p.activity());
        return player;
    }

    private static Agent toAgent(final SerializedAgent a) {
        final Agent agent = new Agent(a.id(), a.playerId(), a.personality(), a.ownerId());
        agent.setInProgressOperation(a.inProgressOperation());
        agent.setLastInviteAttempt(a.lastInviteAttempt());
        return agent;
    }

    private static Conversation toConversation(final SerializedConversation c) {
        return Conversation.restore(c.id(), c.creator(), c.created(), new LinkedHashSet<>(c.participants()),
            c.invitee(), c.lastMessage(), c.numMessages(), new LinkedHashSet<>(c.typing()), c.finished(), c.finishedAt());
    }
}
