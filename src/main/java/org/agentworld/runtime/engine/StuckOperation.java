package org.agentworld.runtime.engine;

import org.agentworld.runtime.model.InProgressOperation;

/**
 * An agent whose in-progress operation has been running longer than the configured timeout.
 */
public record StuckOperation(String worldId, String agentId, String playerId, InProgressOperation operation, long age) {
}
