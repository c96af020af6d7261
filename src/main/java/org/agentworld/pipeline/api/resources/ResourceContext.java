package org.agentworld.pipeline.api.resources;

import java.util.Map;

/**
 * A parsed resource binding of a service port, written as
 * {@code "usageType:resourceName?key=value"} in the configuration.
 *
 * @param serviceName  The service that uses the resource.
 * @param portName     The port in the service's {@code resources} block.
 * @param usageType    How the resource is used, or {@code null} if the URI has no prefix.
 * @param resourceName The name of the bound resource.
 * @param parameters   Additional query parameters of the URI.
 */
public record ResourceContext(
        String serviceName,
        String portName,
        String usageType,
        String resourceName,
        Map<String, String> parameters
) {
}
