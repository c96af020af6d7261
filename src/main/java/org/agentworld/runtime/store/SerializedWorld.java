package org.agentworld.runtime.store;

import org.agentworld.runtime.model.Activity;
import org.agentworld.runtime.model.Facing;
import org.agentworld.runtime.model.InProgressOperation;
import org.agentworld.runtime.model.Message;
import org.agentworld.runtime.model.Pathfinding;
import org.agentworld.runtime.model.Personality;
import org.agentworld.runtime.model.Position;

import java.util.List;

/**
 * Immutable, JSON-friendly form of a {@link org.agentworld.runtime.model.World}. Set-valued fields
 * are sorted so that equal worlds always serialize to equal documents.
 */
public record SerializedWorld(
    String worldId,
    long nextId,
    List<SerializedPlayer> players,
    List<SerializedAgent> agents,
    List<SerializedConversation> conversations,
    List<SerializedArchiveEntry<SerializedPlayer>> archivedPlayers,
    List<SerializedArchiveEntry<SerializedAgent>> archivedAgents,
    List<SerializedArchiveEntry<SerializedConversation>> archivedConversations
) {

    public SerializedWorld {
        players = players == null ? List.of() : List.copyOf(players);
        agents = agents == null ? List.of() : List.copyOf(agents);
        conversations = conversations == null ? List.of() : List.copyOf(conversations);
        archivedPlayers = archivedPlayers == null ? List.of() : List.copyOf(archivedPlayers);
        archivedAgents = archivedAgents == null ? List.of() : List.copyOf(archivedAgents);
        archivedConversations = archivedConversations == null ? List.of() : List.copyOf(archivedConversations);
    }

    public record SerializedPlayer(String id, String name, String ownerId, Position position, Facing facing,
                                   double speed, Pathfinding pathfinding, Activity activity, String zone,
                                   long lastInput) {
    }

    public record SerializedAgent(String id, String playerId, Personality personality, String ownerId,
                                  InProgressOperation inProgressOperation, Long lastInviteAttempt) {
    }

    public record SerializedConversation(String id, String creator, long created, List<String> participants,
                                         String invitee, Message lastMessage, int numMessages,
                                         List<String> typing, boolean finished, Long finishedAt) {
        public SerializedConversation {
            participants = participants == null ? List.of() : List.copyOf(participants);
            typing = typing == null ? List.of() : List.copyOf(typing);
        }
    }

    public record SerializedArchiveEntry<T>(T entity, long archivedAt, String reason) {
    }
}
