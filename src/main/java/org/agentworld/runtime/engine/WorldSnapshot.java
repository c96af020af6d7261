package org.agentworld.runtime.engine;

import org.agentworld.runtime.store.SerializedWorld;

/**
 * An immutable view of a world as of the end of a committed step.
 *
 * @param worldId              The world.
 * @param processedInputNumber Number of the last input reflected in the state, 0 if none.
 * @param publishedAt          Epoch millis of the step that produced the state.
 * @param state                The world state.
 */
public record WorldSnapshot(String worldId, long processedInputNumber, long publishedAt, SerializedWorld state) {
}
