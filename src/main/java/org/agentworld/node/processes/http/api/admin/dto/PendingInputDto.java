package org.agentworld.node.processes.http.api.admin.dto;

import com.fasterxml.jackson.databind.JsonNode;
import org.agentworld.runtime.engine.InputRecord;

public record PendingInputDto(String worldId, long number, String name, JsonNode args, long receivedAt, long ageMs) {

    public static PendingInputDto from(final InputRecord input, final long now) {
        return new PendingInputDto(input.worldId(), input.number(), input.name(), input.args(), input.receivedAt(),
            input.ageAt(now));
    }
}
