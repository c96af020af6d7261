package org.agentworld.pipeline.api.services;

import org.agentworld.pipeline.api.resources.OperationalError;

import java.util.List;

/**
 * A long-running unit of work managed by the {@code ServiceManager}.
 */
public interface IService {

    /**
     * Lifecycle state of a service.
     */
    enum State {
        STOPPED,
        RUNNING,
        PAUSED,
        ERROR
    }

    /**
     * Starts the service in its own thread.
     *
     * @throws IllegalStateException if the service is not STOPPED.
     */
    void start();

    /**
     * Stops the service and waits for its thread to terminate.
     *
     * @throws IllegalStateException if the service is neither RUNNING nor PAUSED.
     */
    void stop();

    void pause();

    void resume();

    void restart();

    State getCurrentState();

    List<OperationalError> getErrors();

    void clearErrors();
}
