package org.agentworld.node.processes.http.api.pipeline.dto;

import org.agentworld.pipeline.api.resources.IMonitorable;
import org.agentworld.pipeline.api.resources.IResource;
import org.agentworld.pipeline.api.resources.OperationalError;

import java.util.List;
import java.util.Map;

public record ResourceStatusDto(String name, String type, Map<String, Number> metrics, List<String> errors, boolean healthy) {

    public static ResourceStatusDto from(final String name, final IResource resource) {
        if (resource instanceof IMonitorable monitorable) {
            return new ResourceStatusDto(name, resource.getClass().getSimpleName(), monitorable.getMetrics(),
                monitorable.getErrors().stream().map(OperationalError::message).toList(), monitorable.isHealthy());
        }
        return new ResourceStatusDto(name, resource.getClass().getSimpleName(), Map.of(), List.of(), true);
    }
}
