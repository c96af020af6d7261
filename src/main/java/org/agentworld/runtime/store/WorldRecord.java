package org.agentworld.runtime.store;

public record WorldRecord(String worldId, long createdAt) {
}
