package org.agentworld.node.spi;

/**
 * A long-running component of the node with its own lifecycle.
 */
public interface IProcess {

    /**
     * Starts the process. Must not block; continuous work runs in threads owned by the process.
     */
    void start();

    /**
     * Stops the process and releases what it holds.
     */
    void stop();
}
