package org.agentworld.node.processes.http.api.world.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.agentworld.runtime.engine.WorldSnapshot;
import org.agentworld.runtime.store.SerializedWorld;
import org.agentworld.runtime.store.SerializedWorld.SerializedAgent;
import org.agentworld.runtime.store.SerializedWorld.SerializedArchiveEntry;
import org.agentworld.runtime.store.SerializedWorld.SerializedConversation;
import org.agentworld.runtime.store.SerializedWorld.SerializedPlayer;

import java.util.List;

/**
 * The published state of a world. Archives are only included on request.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SnapshotDto(
    String worldId,
    long nextId,
    long processedInputNumber,
    long publishedAt,
    List<SerializedPlayer> players,
    List<SerializedAgent> agents,
    List<SerializedConversation> conversations,
    List<SerializedArchiveEntry<SerializedPlayer>> archivedPlayers,
    List<SerializedArchiveEntry<SerializedAgent>> archivedAgents,
    List<SerializedArchiveEntry<SerializedConversation>> archivedConversations
) {
    public static SnapshotDto from(final WorldSnapshot snapshot, final boolean includeArchived) {
        final SerializedWorld state = snapshot.state();
        return new SnapshotDto(snapshot.worldId(), state.nextId(), snapshot.processedInputNumber(), snapshot.publishedAt(),
            state.players(), state.agents(), state.conversations(),
            includeArchived ? state.archivedPlayers() : null,
            includeArchived ? state.archivedAgents() : null,
            includeArchived ? state.archivedConversations() : null);
    }
}
