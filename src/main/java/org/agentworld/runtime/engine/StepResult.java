package org.agentworld.runtime.engine;

/**
 * Summary of one engine step.
 *
 * @param worldId               The stepped world.
 * @param inputsApplied         Inputs that completed with an OK outcome.
 * @param inputsFailed          Inputs that completed with an ERROR outcome.
 * @param processedInputNumber  Number of the last input processed so far.
 * @param simulatedMs           Simulated time advanced by the tick.
 */
public record StepResult(String worldId, int inputsApplied, int inputsFailed, long processedInputNumber, long simulatedMs) {
}
