package org.agentworld.pipeline.api.resources;

import java.util.List;
import java.util.Map;

/**
 * A component that exposes metrics, operational errors and a health flag.
 * Implemented by services, resources and the {@code ServiceManager} itself.
 */
public interface IMonitorable {

    /**
     * Returns the current metrics of the component, keyed by metric name
     * (e.g. "steps_completed", "inputs_pending").
     *
     * @return A map of metric names to their current values.
     */
    Map<String, Number> getMetrics();

    /**
     * Returns the operational errors recorded since the last {@link #clearErrors()}.
     *
     * @return A list of {@link OperationalError}s, oldest first.
     */
    List<OperationalError> getErrors();

    /**
     * Clears the recorded errors, typically after an operator has looked at them.
     */
    void clearErrors();

    /**
     * @return true if the component is operational, false if it is degraded or failed.
     */
    boolean isHealthy();
}
