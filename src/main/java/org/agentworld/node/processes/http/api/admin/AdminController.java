package org.agentworld.node.processes.http.api.admin;

import com.fasterxml.jackson.databind.JsonNode;
import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.agentworld.node.processes.http.AbstractController;
import org.agentworld.node.processes.http.api.admin.dto.PendingInputDto;
import org.agentworld.node.processes.http.api.dto.MessageResponseDto;
import org.agentworld.node.processes.http.api.instances.dto.InstanceDto;
import org.agentworld.node.spi.ServiceRegistry;
import org.agentworld.pipeline.resources.WorldRegistry;
import org.agentworld.runtime.ValidationException;
import org.agentworld.runtime.engine.InputRecord;
import org.agentworld.runtime.engine.WorldEngine;
import org.agentworld.runtime.instances.InstanceManager;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Operator endpoints: inspect pending inputs and stuck operations, trigger recovery sweeps,
 * check instance health, take instances in and out of rotation and maintain the owner directory.
 */
public class AdminController extends AbstractController {

    private final WorldRegistry worlds;
    private final InstanceManager instances;

    public AdminController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        this.worlds = registry.get(WorldRegistry.class);
        this.instances = worlds.getInstanceManager();
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.get(path(basePath, "/inputs/pending"), this::listPendingInputs);
        app.get(path(basePath, "/worlds/{worldId}/stuck-operations"), this::listStuckOperations);

        app.post(path(basePath, "/sweeps/stuck-inputs"), this::sweepStuckInputs);
        app.post(path(basePath, "/sweeps/stuck-operations"), ctx -> ctx.json(worlds.getSweeper().sweepStuckOperations()));
        app.post(path(basePath, "/sweeps/orphans"), ctx -> ctx.json(worlds.getSweeper().sweepOrphans()));

        app.get(path(basePath, "/instances/health"), ctx -> ctx.json(instances.healthReport()));
        app.post(path(basePath, "/instances/{instanceId}/maintenance"), this::setMaintenance);
        app.post(path(basePath, "/instances/{instanceId}/reassign"), ctx ->
            ctx.json(InstanceDto.from(instances.reassignWorld(longPathParam(ctx, "instanceId")))));
        app.post(path(basePath, "/instances/{instanceId}/over-capacity"), this::grantOverCapacity);

        app.get(path(basePath, "/owners"), ctx -> ctx.json(worlds.getOwners().listOwners()));
        app.post(path(basePath, "/owners/{ownerId}"), this::registerOwner);
        app.delete(path(basePath, "/owners/{ownerId}"), this::removeOwner);
        registerExceptionHandlers(app);
    }

    void listPendingInputs(final Context ctx) {
        final long now = worlds.getClock().millis();
        final List<PendingInputDto> pending = new ArrayList<>();
        for (final WorldEngine engine : worlds.allEngines()) {
            for (final InputRecord input : engine.pendingInputs()) {
                pending.add(PendingInputDto.from(input, now));
            }
        }
        pending.sort(Comparator.comparingLong(PendingInputDto::ageMs).reversed());
        ctx.status(HttpStatus.OK).json(pending);
    }

    void listStuckOperations(final Context ctx) {
        ctx.status(HttpStatus.OK).json(worlds.getEngine(ctx.pathParam("worldId")).stuckOperations());
    }

    void sweepStuckInputs(final Context ctx) {
        final String raw = ctx.queryParam("thresholdMs");
        Long threshold = null;
        if (raw != null) {
            try {
                threshold = Long.parseLong(raw);
            } catch (final NumberFormatException e) {
                throw new ValidationException("thresholdMs must be a number, got '" + raw + "'");
            }
            if (threshold < 0) {
                throw new ValidationException("thresholdMs must not be negative");
            }
        }
        ctx.status(HttpStatus.OK).json(worlds.getSweeper().sweepStuckInputs(threshold));
    }

    void setMaintenance(final Context ctx) {
        final String enabled = ctx.queryParam("enabled");
        final boolean maintenance = enabled == null || Boolean.parseBoolean(enabled);
        ctx.status(HttpStatus.OK).json(InstanceDto.from(instances.setMaintenance(longPathParam(ctx, "instanceId"), maintenance)));
    }

    void grantOverCapacity(final Context ctx) {
        final JsonNode body = readBody(ctx);
        if (!body.hasNonNull("untilMs") || !body.get("untilMs").canConvertToLong()) {
            throw new ValidationException("Field 'untilMs' (epoch millis) is required");
        }
        final long instanceId = longPathParam(ctx, "instanceId");
        ctx.status(HttpStatus.OK).json(InstanceDto.from(instances.grantOverCapacity(instanceId, body.get("untilMs").asLong())));
    }

    void registerOwner(final Context ctx) {
        final String ownerId = ctx.pathParam("ownerId");
        final boolean added = worlds.getOwners().register(ownerId);
        ctx.status(added ? HttpStatus.CREATED : HttpStatus.OK)
            .json(new MessageResponseDto(added ? "Owner '" + ownerId + "' registered." : "Owner '" + ownerId + "' already registered."));
    }

    void removeOwner(final Context ctx) {
        final String ownerId = ctx.pathParam("ownerId");
        if (!worlds.getOwners().remove(ownerId)) {
            throw new IllegalArgumentException("Unknown owner " + ownerId);
        }
        ctx.status(HttpStatus.OK).json(new MessageResponseDto("Owner '" + ownerId + "' removed."));
    }
}
