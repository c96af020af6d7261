package org.agentworld.pipeline.api.services;

import org.agentworld.pipeline.api.resources.OperationalError;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time status of one configured service.
 *
 * @param state            The lifecycle state. STOPPED if no instance exists yet.
 * @param healthy          Whether the service considers itself healthy.
 * @param metrics          The service's current metrics.
 * @param errors           Recorded operational errors.
 * @param resourceBindings The resources bound to the current instance.
 */
public record ServiceStatus(
    IService.State state,
    boolean healthy,
    Map<String, Number> metrics,
    List<OperationalError> errors,
    List<ResourceBinding> resourceBindings
) {
}
