package org.agentworld.pipeline.api.services;

import org.agentworld.pipeline.api.resources.IResource;
import org.agentworld.pipeline.api.resources.ResourceContext;

/**
 * A resource bound to a port of a running service instance.
 *
 * @param context  The parsed binding.
 * @param service  The service instance the resource was injected into.
 * @param resource The injected resource.
 */
public record ResourceBinding(
    ResourceContext context,
    IService service,
    IResource resource
) {

    public IResource.UsageState usageState() {
        return resource.getUsageState(context.usageType());
    }
}
