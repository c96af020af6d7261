package org.agentworld.runtime.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The complete mutable state of one simulated environment.
 * <p>
 * Entity containers are keyed by id; iteration order is insertion order but no behavior may
 * depend on it. Entities are never deleted: removal moves them into the matching archive.
 * <p>
 * A {@code World} instance is only ever mutated by the single writer of its world. Readers get
 * instances that have been published and are not touched afterwards; the writer always works on
 * a {@link #copy()}.
 */
public class World {

    public static final String PLAYER_PREFIX = "p";
    public static final String AGENT_PREFIX = "a";
    public static final String CONVERSATION_PREFIX = "c";

    private final String worldId;
    private long nextId;
    private final Map<String, Player> players = new LinkedHashMap<>();
    private final Map<String, Agent> agents = new LinkedHashMap<>();
    private final Map<String, Conversation> conversations = new LinkedHashMap<>();
    private final Map<String, ArchiveEntry<Player>> archivedPlayers = new LinkedHashMap<>();
    private final Map<String, ArchiveEntry<Agent>> archivedAgents = new LinkedHashMap<>();
    private final Map<String, ArchiveEntry<Conversation>> archivedConversations = new LinkedHashMap<>();

    public World(final String worldId) {
        this(worldId, 0);
    }

    public World(final String worldId, final long nextId) {
        this.worldId = worldId;
        this.nextId = nextId;
    }

    /**
     * Creates a deep copy of the live entities. Archive entries are shared because they are
     * never modified.
     */
    public World copy() {
        final World copy = new World(worldId, nextId);
        players.forEach((id, p) -> copy.players.put(id, p.copy()));
        agents.forEach((id, a) -> copy.agents.put(id, a.copy()));
        conversations.forEach((id, c) -> copy.conversations.put(id, c.copy()));
        copy.archivedPlayers.putAll(archivedPlayers);
        copy.archivedAgents.putAll(archivedAgents);
        copy.archivedConversations.putAll(archivedConversations);
        return copy;
    }

    public String getWorldId() {
        return worldId;
    }

    public long getNextId() {
        return nextId;
    }

    /**
     * Allocates a new entity id from the world's single monotonic counter.
     *
     * @param prefix One of {@link #PLAYER_PREFIX}, {@link #AGENT_PREFIX}, {@link #CONVERSATION_PREFIX}.
     * @return The new id, e.g. {@code p:4}.
     */
    public String allocateId(final String prefix) {
        return prefix + ":" + (nextId++);
    }

    public Optional<Player> findPlayer(final String playerId) {
        return Optional.ofNullable(players.get(playerId));
    }

    public Optional<Agent> findAgent(final String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    public Optional<Conversation> findConversation(final String conversationId) {
        return Optional.ofNullable(conversations.get(conversationId));
    }

    public Optional<Agent> findAgentByPlayer(final String playerId) {
        return agents.values().stream().filter(a -> a.getPlayerId().equals(playerId)).findFirst();
    }

    /**
     * @return The non-finished conversation the player takes part in or is invited to, if any.
     */
    public Optional<Conversation> activeConversationOf(final String playerId) {
        return conversations.values().stream()
            .filter(c -> !c.isFinished() && c.involves(playerId))
            .findFirst();
    }

    public Collection<Player> getPlayers() {
        return Collections.unmodifiableCollection(players.values());
    }

    public Collection<Agent> getAgents() {
        return Collections.unmodifiableCollection(agents.values());
    }

    public Collection<Conversation> getConversations() {
        return Collections.unmodifiableCollection(conversations.values());
    }

    public Map<String, ArchiveEntry<Player>> getArchivedPlayers() {
        return Collections.unmodifiableMap(archivedPlayers);
    }

    public Map<String, ArchiveEntry<Agent>> getArchivedAgents() {
        return Collections.unmodifiableMap(archivedAgents);
    }

    public Map<String, ArchiveEntry<Conversation>> getArchivedConversations() {
        return Collections.unmodifiableMap(archivedConversations);
    }

    public void addPlayer(final Player player) {
        requireUnused(player.getId());
        players.put(player.getId(), player);
    }

    public void addAgent(final Agent agent) {
        requireUnused(agent.getId());
        if (!players.containsKey(agent.getPlayerId())) {
            throw new IllegalStateException("Agent " + agent.getId() + " references unknown player " + agent.getPlayerId());
        }
        agents.put(agent.getId(), agent);
    }

    public void addConversation(final Conversation conversation) {
        requireUnused(conversation.getId());
        conversations.put(conversation.getId(), conversation);
    }

    /**
     * Moves a player into the archive. The caller is responsible for archiving the player's agent
     * first and for taking the player out of its conversation.
     */
    public void archivePlayer(final String playerId, final long now, final String reason) {
        final Player player = players.remove(playerId);
        if (player != null) {
            archivedPlayers.put(playerId, new ArchiveEntry<>(player, now, reason));
        }
    }

    public void archiveAgent(final String agentId, final long now, final String reason) {
        final Agent agent = agents.remove(agentId);
        if (agent != null) {
            archivedAgents.put(agentId, new ArchiveEntry<>(agent, now, reason));
        }
    }

    public void archiveConversation(final String conversationId, final long now, final String reason) {
        final Conversation conversation = conversations.get(conversationId);
        if (conversation == null) {
            return;
        }
        if (!conversation.isFinished()) {
            throw new IllegalStateException("Conversation " + conversationId + " must be finished before it is archived");
        }
        conversations.remove(conversationId);
        archivedConversations.put(conversationId, new ArchiveEntry<>(conversation, now, reason));
    }

    /**
     * Restores an archive entry from persisted state.
     */
    public void restoreArchivedPlayer(final ArchiveEntry<Player> entry) {
        archivedPlayers.put(entry.entity().getId(), entry);
    }

    public void restoreArchivedAgent(final ArchiveEntry<Agent> entry) {
        archivedAgents.put(entry.entity().getId(), entry);
    }

    public void restoreArchivedConversation(final ArchiveEntry<Conversation> entry) {
        archivedConversations.put(entry.entity().getId(), entry);
    }

    private void requireUnused(final String id) {
        if (players.containsKey(id) || agents.containsKey(id) || conversations.containsKey(id)
                || archivedPlayers.containsKey(id) || archivedAgents.containsKey(id)
                || archivedConversations.containsKey(id)) {
            throw new IllegalStateException("Id " + id + " is already in use");
        }
    }
}
