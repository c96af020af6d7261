package org.agentworld.runtime.store;

/**
 * The latest committed state of a world.
 *
 * @param worldId              The world.
 * @param processedInputNumber Number of the last input reflected in the snapshot, 0 if none.
 * @param json                 The world serialized by {@link WorldSerializer}.
 * @param savedAt              Epoch millis of the commit.
 */
public record StoredSnapshot(String worldId, long processedInputNumber, String json, long savedAt) {
}
