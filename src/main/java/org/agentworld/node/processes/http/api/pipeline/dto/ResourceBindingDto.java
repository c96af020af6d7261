package org.agentworld.node.processes.http.api.pipeline.dto;

import org.agentworld.pipeline.api.resources.IResource;
import org.agentworld.pipeline.api.services.ResourceBinding;

public record ResourceBindingDto(String portName, String resourceName, String usageType, IResource.UsageState state) {

    public static ResourceBindingDto from(final ResourceBinding binding) {
        return new ResourceBindingDto(binding.context().portName(), binding.context().resourceName(),
            binding.context().usageType(), binding.usageState());
    }
}
