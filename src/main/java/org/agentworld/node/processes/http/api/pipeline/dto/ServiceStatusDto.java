package org.agentworld.node.processes.http.api.pipeline.dto;

import org.agentworld.pipeline.api.services.IService;
import org.agentworld.pipeline.api.services.ServiceStatus;

import java.util.List;
import java.util.Map;

public record ServiceStatusDto(
    String name,
    IService.State state,
    boolean healthy,
    Map<String, Number> metrics,
    List<String> errors,
    List<ResourceBindingDto> resourceBindings
) {
    public static ServiceStatusDto from(final String name, final ServiceStatus status) {
        return new ServiceStatusDto(
            name,
            status.state(),
            status.healthy(),
            status.metrics(),
            status.errors().stream().map(e -> e.errorType() + ": " + e.message()).toList(),
            status.resourceBindings().stream().map(ResourceBindingDto::from).toList());
    }
}
