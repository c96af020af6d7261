package org.agentworld.node.processes.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.agentworld.node.processes.http.api.dto.ErrorResponseDto;
import org.agentworld.node.spi.IController;
import org.agentworld.node.spi.ServiceRegistry;
import org.agentworld.runtime.ValidationException;
import org.agentworld.runtime.engine.InputRejectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class of controllers: holds the registry and the controller options, and installs the
 * shared mapping of exceptions to HTTP error responses.
 * <ul>
 *   <li>{@link ValidationException}: 400</li>
 *   <li>{@link IllegalArgumentException} (unknown world, instance or service): 404</li>
 *   <li>{@link IllegalStateException} (invalid state transition): 409</li>
 *   <li>{@link InputRejectedException}: 429</li>
 *   <li>anything else: 500</li>
 * </ul>
 */
public abstract class AbstractController implements IController {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractController.class);
    protected static final ObjectMapper MAPPER = new ObjectMapper();

    protected final ServiceRegistry registry;
    protected final Config options;

    protected AbstractController(final ServiceRegistry registry, final Config options) {
        this.registry = registry;
        this.options = options;
    }

    /**
     * Joins the mount path and a route suffix, e.g. {@code ("/api/worlds/", "/{worldId}")}.
     */
    protected static String path(final String basePath, final String suffix) {
        final String base = basePath.endsWith("/") ? basePath.substring(0, basePath.length() - 1) : basePath;
        final String joined = base + suffix;
        return joined.isEmpty() ? "/" : joined;
    }

    /**
     * Parses the request body as JSON. An empty body yields an empty object.
     *
     * @throws ValidationException if the body is not valid JSON.
     */
    protected static JsonNode readBody(final Context ctx) {
        final String body = ctx.body();
        if (body == null || body.isBlank()) {
            return MAPPER.createObjectNode();
        }
        try {
            return MAPPER.readTree(body);
        } catch (final JsonProcessingException e) {
            throw new ValidationException("Request body is not valid JSON: " + e.getOriginalMessage());
        }
    }

    /**
     * @throws ValidationException if the path parameter is not a number.
     */
    protected static long longPathParam(final Context ctx, final String name) {
        final String raw = ctx.pathParam(name);
        try {
            return Long.parseLong(raw);
        } catch (final NumberFormatException e) {
            throw new ValidationException("Path parameter '" + name + "' must be a number, got '" + raw + "'");
        }
    }

    protected void registerExceptionHandlers(final Javalin app) {
        app.exception(ValidationException.class, (e, ctx) -> respond(ctx, HttpStatus.BAD_REQUEST, e.getMessage()));
        app.exception(IllegalArgumentException.class, (e, ctx) -> respond(ctx, HttpStatus.NOT_FOUND, e.getMessage()));
        app.exception(IllegalStateException.class, (e, ctx) -> respond(ctx, HttpStatus.CONFLICT, e.getMessage()));
        app.exception(InputRejectedException.class, (e, ctx) -> respond(ctx, HttpStatus.TOO_MANY_REQUESTS, e.getMessage()));
        app.exception(Exception.class, (e, ctx) -> {
            LOGGER.error("Unhandled exception for {} {}: {}", ctx.method(), ctx.path(), e.toString());
            LOGGER.debug("Exception details:", e);
            ctx.status(HttpStatus.INTERNAL_SERVER_ERROR).json(ErrorResponseDto.of(
                HttpStatus.INTERNAL_SERVER_ERROR.getCode(),
                HttpStatus.INTERNAL_SERVER_ERROR.getMessage(),
                e.getMessage() != null ? e.getMessage() : "An internal server error occurred."));
        });
    }

    private static void respond(final Context ctx, final HttpStatus status, final String message) {
        LOGGER.debug("{} {} -> {}: {}", ctx.method(), ctx.path(), status.getCode(), message);
        ctx.status(status).json(ErrorResponseDto.of(status.getCode(), status.getMessage(), message));
    }
}
