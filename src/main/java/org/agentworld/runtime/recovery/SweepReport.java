package org.agentworld.runtime.recovery;

import java.util.List;

/**
 * Outcome of one sweep pass.
 *
 * @param sweep     Name of the pass.
 * @param startedAt Epoch millis at which the pass started.
 * @param affected  Ids of everything the pass repaired or scheduled for repair.
 */
public record SweepReport(String sweep, long startedAt, List<String> affected) {

    public SweepReport {
        affected = List.copyOf(affected);
    }

    public int count() {
        return affected.size();
    }
}
