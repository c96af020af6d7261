package org.agentworld.pipeline.services;

import com.typesafe.config.Config;
import org.agentworld.pipeline.api.resources.IMonitorable;
import org.agentworld.pipeline.api.resources.IResource;
import org.agentworld.pipeline.api.resources.OperationalError;
import org.agentworld.pipeline.api.services.IService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base class of all services: lifecycle state machine, a dedicated worker thread, typed access to
 * injected resources and bounded error tracking. Subclasses implement {@link #run()}.
 * <p>
 * <strong>Error policy:</strong>
 * <ul>
 *   <li>Transient errors (one step failed to commit, one sweep pass failed): log at WARN without
 *       the exception, call {@link #recordError(String, String, String)} and keep running.</li>
 *   <li>Fatal errors: log at ERROR and throw. The service moves to {@link State#ERROR}.</li>
 *   <li>Interruption is a normal shutdown. Let the {@link InterruptedException} propagate.</li>
 * </ul>
 * Stack traces are only logged at DEBUG.
 */
public abstract class AbstractService implements IService, IMonitorable {

    private static final long STOP_TIMEOUT_MS = 5000;

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final String serviceName;
    protected final Config options;
    protected final Map<String, List<IResource>> resources;
    private final AtomicReference<State> currentState = new AtomicReference<>(State.STOPPED);
    private final Object pauseLock = new Object();
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();
    private Thread serviceThread;

    protected AbstractService(final String name, final Config options, final Map<String, List<IResource>> resources) {
        this.serviceName = name;
        this.options = options;
        this.resources = resources != null ? resources : Collections.emptyMap();
    }

    /**
     * Upper bound of errors kept in memory. The oldest are dropped first.
     */
    protected int getMaxErrors() {
        return 10000;
    }

    public String getServiceName() {
        return serviceName;
    }

    @Override
    public final void start() {
        if (!currentState.compareAndSet(State.STOPPED, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot start service '%s' in state %s", serviceName, getCurrentState()));
        }
        serviceThread = new Thread(this::runService, serviceName);
        serviceThread.start();
        logStarted();
    }

    /**
     * Logs the startup line. Services override this to include their effective settings.
     */
    protected void logStarted() {
        log.info("{} started", serviceName);
    }

    @Override
    public final void stop() {
        final State state = getCurrentState();
        if (state != State.RUNNING && state != State.PAUSED) {
            throw new IllegalStateException(String.format("Cannot stop service '%s' in state %s", serviceName, state));
        }
        if (state == State.PAUSED) {
            synchronized (pauseLock) {
                pauseLock.notifyAll();
            }
        }
        if (serviceThread != null) {
            serviceThread.interrupt();
            try {
                serviceThread.join(STOP_TIMEOUT_MS);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for {} to stop", serviceName);
            }
            if (serviceThread.isAlive()) {
                log.error("{} did not stop within {}ms, marking it as ERROR", serviceName, STOP_TIMEOUT_MS);
                currentState.set(State.ERROR);
                return;
            }
        }
        if (getCurrentState() != State.STOPPED && getCurrentState() != State.ERROR) {
            currentState.set(State.STOPPED);
        }
        log.debug("{} stopped", serviceName);
    }

    @Override
    public final void pause() {
        if (!currentState.compareAndSet(State.RUNNING, State.PAUSED)) {
            throw new IllegalStateException(String.format("Cannot pause service '%s' in state %s", serviceName, getCurrentState()));
        }
        log.info("{} paused", serviceName);
    }

    @Override
    public final void resume() {
        if (!currentState.compareAndSet(State.PAUSED, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot resume service '%s' in state %s", serviceName, getCurrentState()));
        }
        log.info("{} resumed", serviceName);
        synchronized (pauseLock) {
            pauseLock.notifyAll();
        }
    }

    @Override
    public void restart() {
        stop();
        start();
    }

    @Override
    public State getCurrentState() {
        return currentState.get();
    }

    private void runService() {
        try {
            run();
        } catch (final InterruptedException e) {
            log.debug("{} interrupted, shutting down", serviceName);
            Thread.currentThread().interrupt();
        } catch (final Exception e) {
            log.error("{} stopped with ERROR due to {}: {}", serviceName, e.getClass().getSimpleName(), e.getMessage());
            log.debug("Exception details:", e);
            currentState.set(State.ERROR);
        } finally {
            if (getCurrentState() != State.ERROR) {
                currentState.set(State.STOPPED);
            }
        }
    }

    /**
     * The service loop, executed in the service's own thread. Implementations call
     * {@link #checkPause()} once per iteration and return or throw {@link InterruptedException}
     * when interrupted.
     *
     * @throws InterruptedException if the service thread is interrupted.
     */
    protected abstract void run() throws InterruptedException;

    /**
     * Blocks while the service is paused.
     *
     * @throws InterruptedException if interrupted while waiting.
     */
    protected void checkPause() throws InterruptedException {
        synchronized (pauseLock) {
            while (getCurrentState() == State.PAUSED) {
                pauseLock.wait();
            }
        }
    }

    /**
     * Returns the single resource bound to {@code portName}.
     *
     * @throws IllegalStateException if the port is unbound, holds more than one resource, or the
     *                               resource is not a {@code T}.
     */
    protected <T extends IResource> T getRequiredResource(final String portName, final Class<T> expectedType) {
        final List<IResource> bound = resources.get(portName);
        if (bound == null || bound.isEmpty()) {
            throw new IllegalStateException("Service '" + serviceName + "' requires a resource on port '" + portName + "'");
        }
        if (bound.size() > 1) {
            throw new IllegalStateException("Port '" + portName + "' has " + bound.size() + " resources, but exactly one is required");
        }
        return cast(portName, bound.get(0), expectedType);
    }

    /**
     * Returns the resource bound to {@code portName}, if any.
     */
    protected <T extends IResource> Optional<T> getOptionalResource(final String portName, final Class<T> expectedType) {
        final List<IResource> bound = resources.get(portName);
        if (bound == null || bound.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(getRequiredResource(portName, expectedType));
    }

    protected boolean hasResource(final String portName) {
        return resources.containsKey(portName) && !resources.get(portName).isEmpty();
    }

    private <T> T cast(final String portName, final IResource resource, final Class<T> expectedType) {
        if (!expectedType.isInstance(resource)) {
            throw new IllegalStateException("Resource on port '" + portName + "' is a " + resource.getClass().getName()
                + ", expected " + expectedType.getName());
        }
        return expectedType.cast(resource);
    }

    /**
     * Records a transient error. Only for errors the service survives; fatal errors are thrown.
     *
     * @param code    Category of the error (e.g. "STEP_COMMIT_FAILED").
     * @param message Human-readable description.
     * @param details Context such as the affected world.
     */
    protected void recordError(final String code, final String message, final String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));
        while (errors.size() > getMaxErrors()) {
            errors.pollFirst();
        }
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    /**
     * A service is healthy while it is not in ERROR and has no recorded errors.
     */
    @Override
    public boolean isHealthy() {
        return getCurrentState() != State.ERROR && errors.isEmpty();
    }

    @Override
    public final Map<String, Number> getMetrics() {
        final Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Adds service-specific metrics. Overrides call {@code super.addCustomMetrics(metrics)} first.
     *
     * @param metrics Mutable map that already holds the base metrics.
     */
    protected void addCustomMetrics(final Map<String, Number> metrics) {
        // no custom metrics by default
    }
}
