package org.agentworld.node.processes.http.api.instances;

import com.fasterxml.jackson.databind.JsonNode;
import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.agentworld.node.processes.http.AbstractController;
import org.agentworld.node.processes.http.api.instances.dto.InstanceDto;
import org.agentworld.node.spi.ServiceRegistry;
import org.agentworld.pipeline.resources.WorldRegistry;
import org.agentworld.runtime.ValidationException;
import org.agentworld.runtime.instances.InstanceAllocation;
import org.agentworld.runtime.instances.InstanceManager;

/**
 * Slot allocation on instances: allocate, release, drain and list.
 */
public class InstanceController extends AbstractController {

    private final InstanceManager instances;

    public InstanceController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        this.instances = registry.get(WorldRegistry.class).getInstanceManager();
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.get(path(basePath, ""), this::listInstances);
        app.post(path(basePath, "/allocate"), this::allocate);
        app.post(path(basePath, "/{instanceId}/release"), this::release);
        app.post(path(basePath, "/{instanceId}/drain"), this::drain);
        registerExceptionHandlers(app);
    }

    void listInstances(final Context ctx) {
        ctx.status(HttpStatus.OK).json(instances.listInstances().stream().map(InstanceDto::from).toList());
    }

    void allocate(final Context ctx) {
        final JsonNode body = readBody(ctx);
        if (!body.hasNonNull("zoneType") || body.get("zoneType").asText().isBlank()) {
            throw new ValidationException("Field 'zoneType' is required");
        }
        final InstanceAllocation allocation = instances.findOrCreateInstance(body.get("zoneType").asText());
        ctx.status(HttpStatus.OK).json(allocation);
    }

    void release(final Context ctx) {
        ctx.status(HttpStatus.OK).json(InstanceDto.from(instances.releaseSlot(longPathParam(ctx, "instanceId"))));
    }

    void drain(final Context ctx) {
        ctx.status(HttpStatus.OK).json(InstanceDto.from(instances.markDraining(longPathParam(ctx, "instanceId"))));
    }
}
