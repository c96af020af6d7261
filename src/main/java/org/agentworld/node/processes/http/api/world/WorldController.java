package org.agentworld.node.processes.http.api.world;

import com.fasterxml.jackson.databind.JsonNode;
import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import io.javalin.openapi.HttpMethod;
import io.javalin.openapi.OpenApi;
import io.javalin.openapi.OpenApiContent;
import io.javalin.openapi.OpenApiParam;
import io.javalin.openapi.OpenApiResponse;
import org.agentworld.node.processes.http.AbstractController;
import org.agentworld.node.processes.http.api.dto.ErrorResponseDto;
import org.agentworld.node.processes.http.api.world.dto.InputAcceptedDto;
import org.agentworld.node.processes.http.api.world.dto.SnapshotDto;
import org.agentworld.node.processes.http.api.world.dto.WorldSummaryDto;
import org.agentworld.node.spi.ServiceRegistry;
import org.agentworld.pipeline.resources.WorldRegistry;
import org.agentworld.runtime.ValidationException;
import org.agentworld.runtime.engine.InputReceipt;
import org.agentworld.runtime.engine.InputRecord;
import org.agentworld.runtime.engine.WorldEngine;

import java.util.List;
import java.util.Map;

/**
 * World endpoints: create and list worlds, submit inputs, look up input outcomes and read the
 * published snapshot. Submission only enqueues; the outcome is available once a step has
 * processed the input.
 */
public class WorldController extends AbstractController {

    private final WorldRegistry worlds;

    public WorldController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        this.worlds = registry.get(WorldRegistry.class);
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.post(path(basePath, ""), this::createWorld);
        app.get(path(basePath, ""), this::listWorlds);
        app.post(path(basePath, "/{worldId}/inputs"), this::submitInput);
        app.get(path(basePath, "/{worldId}/inputs/{number}"), this::getInput);
        app.get(path(basePath, "/{worldId}/snapshot"), this::getSnapshot);
        registerExceptionHandlers(app);
    }

    void createWorld(final Context ctx) {
        final String worldId = worlds.createWorld();
        ctx.status(HttpStatus.CREATED).json(Map.of("worldId", worldId));
    }

    void listWorlds(final Context ctx) {
        final List<WorldSummaryDto> summaries = worlds.allEngines().stream().map(WorldSummaryDto::from).toList();
        ctx.status(HttpStatus.OK).json(summaries);
    }

    @OpenApi(
        path = "{worldId}/inputs",
        methods = {HttpMethod.POST},
        summary = "Submit an input",
        description = "Validates and enqueues a command. The input is applied by a later step.",
        tags = {"worlds"},
        pathParams = {@OpenApiParam(name = "worldId", required = true)},
        responses = {
            @OpenApiResponse(status = "202", content = @OpenApiContent(from = InputAcceptedDto.class)),
            @OpenApiResponse(status = "400", description = "Malformed command", content = @OpenApiContent(from = ErrorResponseDto.class)),
            @OpenApiResponse(status = "404", description = "Unknown world", content = @OpenApiContent(from = ErrorResponseDto.class)),
            @OpenApiResponse(status = "429", description = "Too many unprocessed inputs", content = @OpenApiContent(from = ErrorResponseDto.class))
        }
    )
    void submitInput(final Context ctx) {
        final WorldEngine engine = worlds.getEngine(ctx.pathParam("worldId"));
        final JsonNode body = readBody(ctx);
        if (!body.hasNonNull("name") || !body.get("name").isTextual()) {
            throw new ValidationException("Field 'name' is required");
        }
        final InputReceipt receipt = engine.submit(body.get("name").asText(), body.get("args"));
        ctx.status(HttpStatus.ACCEPTED).json(InputAcceptedDto.from(receipt));
    }

    @OpenApi(
        path = "{worldId}/inputs/{number}",
        methods = {HttpMethod.GET},
        summary = "Get an input and its outcome",
        tags = {"worlds"},
        responses = {
            @OpenApiResponse(status = "200", content = @OpenApiContent(from = InputRecord.class)),
            @OpenApiResponse(status = "404", description = "Unknown world or input", content = @OpenApiContent(from = ErrorResponseDto.class))
        }
    )
    void getInput(final Context ctx) {
        final WorldEngine engine = worlds.getEngine(ctx.pathParam("worldId"));
        final long number = longPathParam(ctx, "number");
        final InputRecord input = engine.findInput(number)
            .orElseThrow(() -> new IllegalArgumentException("Unknown input " + engine.getWorldId() + "#" + number));
        ctx.status(HttpStatus.OK).json(input);
    }

    void getSnapshot(final Context ctx) {
        final WorldEngine engine = worlds.getEngine(ctx.pathParam("worldId"));
        final boolean includeArchived = Boolean.parseBoolean(ctx.queryParam("includeArchived"));
        ctx.status(HttpStatus.OK).json(SnapshotDto.from(engine.snapshot(), includeArchived));
    }
}
