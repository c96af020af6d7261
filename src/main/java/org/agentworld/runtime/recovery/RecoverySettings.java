package org.agentworld.runtime.recovery;

import java.util.Set;

/**
 * Thresholds of the recovery sweeps, one per class of operation.
 *
 * @param stuckInputThresholdMs     Age after which an ordinary pending input counts as stuck.
 * @param longRunningThresholdMs    The same for inputs named in {@code longRunningCommands}.
 * @param longRunningCommands       Input names that are allowed to wait longer.
 * @param stuckOperationThresholdMs Age after which an agent operation is force-cleared.
 */
public record RecoverySettings(
    long stuckInputThresholdMs,
    long longRunningThresholdMs,
    Set<String> longRunningCommands,
    long stuckOperationThresholdMs
) {

    public RecoverySettings {
        longRunningCommands = Set.copyOf(longRunningCommands);
    }

    public static RecoverySettings defaults() {
        return new RecoverySettings(300_000, 1_800_000, Set.of(), 120_000);
    }

    public long thresholdFor(final String inputName) {
        return longRunningCommands.contains(inputName) ? longRunningThresholdMs : stuckInputThresholdMs;
    }
}
