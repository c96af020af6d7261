package org.agentworld.pipeline.services.world;

import com.typesafe.config.Config;
import org.agentworld.pipeline.api.resources.IResource;
import org.agentworld.pipeline.resources.WorldRegistry;
import org.agentworld.pipeline.services.AbstractService;
import org.agentworld.runtime.engine.StepResult;
import org.agentworld.runtime.engine.WorldEngine;
import org.agentworld.runtime.store.StoreException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives the simulation: every step interval, runs one step of every world of the bound
 * {@link WorldRegistry}. Worlds are stepped in parallel on a fixed worker pool; each world is
 * stepped by at most one worker at a time.
 *
 * <h3>Configuration Options:</h3>
 * <ul>
 *   <li><b>workerThreads</b>: Size of the worker pool (default: 4).</li>
 *   <li><b>stepIntervalMs</b>: Overrides the registry's step interval.</li>
 * </ul>
 *
 * <h3>Resources:</h3>
 * <ul>
 *   <li><b>worlds</b>: the {@link WorldRegistry}.</li>
 * </ul>
 */
public class WorldEngineService extends AbstractService {

    private final int workerThreads;
    private final Long stepIntervalOverrideMs;

    private final AtomicLong stepsCompleted = new AtomicLong(0);
    private final AtomicLong stepsFailed = new AtomicLong(0);
    private final AtomicLong inputsApplied = new AtomicLong(0);
    private final AtomicLong inputsFailed = new AtomicLong(0);
    private final AtomicLong lastRoundDurationMs = new AtomicLong(0);
    private volatile int worldsStepped;

    public WorldEngineService(final String name, final Config options, final Map<String, List<IResource>> resources) {
        super(name, options, resources);
        this.workerThreads = options.hasPath("workerThreads") ? options.getInt("workerThreads") : 4;
        this.stepIntervalOverrideMs = options.hasPath("stepIntervalMs") ? options.getLong("stepIntervalMs") : null;
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be positive, got " + workerThreads);
        }
    }

    @Override
    protected void logStarted() {
        log.info("{} started: {} worker threads", serviceName, workerThreads);
    }

    @Override
    protected void run() throws InterruptedException {
        final WorldRegistry registry = getRequiredResource("worlds", WorldRegistry.class);
        final long intervalMs = stepIntervalOverrideMs != null ? stepIntervalOverrideMs : registry.getEngineSettings().stepIntervalMs();
        final AtomicInteger threadCounter = new AtomicInteger();
        final ExecutorService workers = Executors.newFixedThreadPool(workerThreads,
            r -> new Thread(r, serviceName + "-worker-" + threadCounter.incrementAndGet()));
        try {
            while (!Thread.currentThread().isInterrupted()) {
                checkPause();
                final long started = System.currentTimeMillis();
                stepAll(workers, registry.allEngines());
                final long elapsed = System.currentTimeMillis() - started;
                lastRoundDurationMs.set(elapsed);
                if (elapsed < intervalMs) {
                    Thread.sleep(intervalMs - elapsed);
                } else {
                    log.debug("Stepping {} worlds took {}ms, longer than the {}ms interval", worldsStepped, elapsed, intervalMs);
                }
            }
        } finally {
            workers.shutdownNow();
        }
    }

    private void stepAll(final ExecutorService workers, final Collection<WorldEngine> engines) throws InterruptedException {
        final List<WorldEngine> ordered = new ArrayList<>(engines);
        final List<Callable<StepResult>> tasks = new ArrayList<>(ordered.size());
        for (final WorldEngine engine : ordered) {
            tasks.add(engine::runStep);
        }
        worldsStepped = tasks.size();
        final List<Future<StepResult>> results = workers.invokeAll(tasks);
        for (int i = 0; i < results.size(); i++) {
            final String worldId = ordered.get(i).getWorldId();
            try {
                final StepResult result = results.get(i).get();
                stepsCompleted.incrementAndGet();
                inputsApplied.addAndGet(result.inputsApplied());
                inputsFailed.addAndGet(result.inputsFailed());
            } catch (final ExecutionException e) {
                stepsFailed.incrementAndGet();
                final Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof StoreException) {
                    log.warn("[{}] Step not committed, inputs stay pending: {}", worldId, cause.getMessage());
                    recordError("STEP_COMMIT_FAILED", "Step could not be committed", "World: " + worldId + ", cause: " + cause.getMessage());
                } else {
                    log.warn("[{}] Step failed: {}", worldId, cause.toString());
                    recordError("STEP_FAILED", "Step failed", "World: " + worldId + ", cause: " + cause);
                }
                log.debug("Step failure details:", cause);
            }
        }
    }

    @Override
    protected void addCustomMetrics(final Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("worlds_stepped", worldsStepped);
        metrics.put("steps_completed", stepsCompleted.get());
        metrics.put("steps_failed", stepsFailed.get());
        metrics.put("inputs_applied", inputsApplied.get());
        metrics.put("inputs_failed", inputsFailed.get());
        metrics.put("last_round_duration_ms", lastRoundDurationMs.get());
    }
}
