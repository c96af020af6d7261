package org.agentworld.node.processes.http.api.world.dto;

import org.agentworld.runtime.engine.InputReceipt;

/**
 * Response to a successful input submission. The input is durably logged but not yet applied.
 */
public record InputAcceptedDto(boolean accepted, String worldId, long inputNumber, long receivedAt) {

    public static InputAcceptedDto from(final InputReceipt receipt) {
        return new InputAcceptedDto(true, receipt.worldId(), receipt.inputNumber(), receipt.receivedAt());
    }
}
