package org.agentworld.runtime.engine;

/**
 * Tunables of a world engine. One threshold per class of operation.
 *
 * @param stepIntervalMs       Target time between two steps.
 * @param maxInputsPerStep     Upper bound of inputs applied in one step.
 * @param maxPendingInputs     Submissions are rejected once this many inputs wait for processing.
 * @param movementSpeed        Tiles per second a moving player covers.
 * @param pathfindingTimeoutMs A movement request older than this is abandoned.
 * @param operationTimeoutMs   An agent operation older than this is flagged as stuck.
 * @param maxStepDurationMs    Upper bound of simulated time advanced in one step.
 */
public record EngineSettings(
    long stepIntervalMs,
    int maxInputsPerStep,
    int maxPendingInputs,
    double movementSpeed,
    long pathfindingTimeoutMs,
    long operationTimeoutMs,
    long maxStepDurationMs
) {

    public EngineSettings {
        if (stepIntervalMs <= 0 || maxInputsPerStep <= 0 || maxPendingInputs <= 0 || maxStepDurationMs <= 0) {
            throw new IllegalArgumentException("Engine intervals and limits must be positive");
        }
        if (movementSpeed <= 0.0) {
            throw new IllegalArgumentException("movementSpeed must be positive, got " + movementSpeed);
        }
    }

    public static EngineSettings defaults() {
        return new EngineSettings(1000, 32, 1000, 0.75, 60_000, 120_000, 1000);
    }
}
