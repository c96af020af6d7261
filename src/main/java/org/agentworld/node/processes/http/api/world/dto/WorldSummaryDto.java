package org.agentworld.node.processes.http.api.world.dto;

import org.agentworld.runtime.engine.WorldEngine;
import org.agentworld.runtime.engine.WorldSnapshot;

public record WorldSummaryDto(
    String worldId,
    long processedInputNumber,
    int pendingInputs,
    int players,
    int agents,
    int conversations
) {
    public static WorldSummaryDto from(final WorldEngine engine) {
        final WorldSnapshot snapshot = engine.snapshot();
        return new WorldSummaryDto(engine.getWorldId(), snapshot.processedInputNumber(), engine.pendingCount(),
            snapshot.state().players().size(), snapshot.state().agents().size(), snapshot.state().conversations().size());
    }
}
