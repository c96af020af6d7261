package org.agentworld.node.processes.http.api.pipeline.dto;

import java.util.List;
import java.util.Map;

/**
 * Overall status: "RUNNING" if every service runs, "IDLE" if none does, "DEGRADED" otherwise.
 */
public record PipelineStatusDto(
    String nodeId,
    String status,
    boolean healthy,
    Map<String, Number> metrics,
    List<ServiceStatusDto> services,
    List<ResourceStatusDto> resources
) {
}
