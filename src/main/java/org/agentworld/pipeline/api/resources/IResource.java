package org.agentworld.pipeline.api.resources;

/**
 * A shared component declared under {@code pipeline.resources} and injected into services.
 * Resources are instantiated once and may be bound to several services.
 */
public interface IResource {

    /**
     * How a resource is currently doing for a particular kind of use.
     */
    enum UsageState {
        ACTIVE,
        WAITING,
        FAILED
    }

    /**
     * @return The name under which the resource was declared.
     */
    String getResourceName();

    /**
     * Reports the state of the resource for the given usage type.
     *
     * @param usageType The usage type from the binding URI, or {@code null} for a plain binding.
     * @return The usage state.
     */
    UsageState getUsageState(String usageType);
}
