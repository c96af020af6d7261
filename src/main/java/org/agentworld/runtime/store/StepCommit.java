package org.agentworld.runtime.store;

import org.agentworld.runtime.engine.InputRecord;

import java.util.List;

/**
 * Everything one engine step writes. A store applies a commit completely or not at all.
 *
 * @param worldId              The stepped world.
 * @param processedInputNumber Number of the last input processed by this or an earlier step.
 * @param snapshotJson         The world after the step.
 * @param completedInputs      The inputs processed by the step, with their outcomes.
 * @param savedAt              Epoch millis of the step.
 */
public record StepCommit(String worldId, long processedInputNumber, String snapshotJson,
                         List<InputRecord> completedInputs, long savedAt) {

    public StepCommit {
        completedInputs = List.copyOf(completedInputs);
    }
}
