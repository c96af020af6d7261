package org.agentworld.node.spi;

import io.javalin.Javalin;

/**
 * An HTTP controller mounted by the HTTP server process.
 */
public interface IController {

    /**
     * Registers the controller's routes.
     *
     * @param app      The Javalin application.
     * @param basePath The path the controller is mounted at, e.g. {@code /api}.
     */
    void registerRoutes(Javalin app, String basePath);
}
