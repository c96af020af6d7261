package org.agentworld.node.spi;

/**
 * A process that exposes one object to the processes that {@code require} it.
 * For example, the pipeline process exposes its {@code ServiceManager} to the HTTP server.
 */
public interface IServiceProvider {

    /**
     * @return The exposed object, or {@code null} if the process exposes nothing.
     */
    Object getExposedService();
}
