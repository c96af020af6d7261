package org.agentworld.pipeline.services.world;

import com.typesafe.config.Config;
import org.agentworld.pipeline.api.resources.IResource;
import org.agentworld.pipeline.resources.WorldRegistry;
import org.agentworld.pipeline.services.AbstractService;
import org.agentworld.runtime.recovery.RecoverySweeper;
import org.agentworld.runtime.recovery.SweepReport;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Runs the recovery sweeps of the bound {@link WorldRegistry} on a schedule.
 *
 * <h3>Configuration Options:</h3>
 * <ul>
 *   <li><b>stuckInputIntervalMs</b>: Period of the stuck-input sweep (default: 60000, 0 disables).</li>
 *   <li><b>stuckOperationIntervalMs</b>: Period of the stuck-operation sweep (default: 30000, 0 disables).</li>
 *   <li><b>orphanSweepIntervalMs</b>: Period of the orphan sweep (default: 0, disabled). Only enable it
 *       when the owner directory is fed with all live owners.</li>
 * </ul>
 */
public class RecoverySweeperService extends AbstractService {

    private final long stuckInputIntervalMs;
    private final long stuckOperationIntervalMs;
    private final long orphanSweepIntervalMs;

    private final AtomicLong passes = new AtomicLong(0);
    private final AtomicLong inputsCleared = new AtomicLong(0);
    private final AtomicLong operationsCleared = new AtomicLong(0);
    private final AtomicLong orphansRepaired = new AtomicLong(0);

    public RecoverySweeperService(final String name, final Config options, final Map<String, List<IResource>> resources) {
        super(name, options, resources);
        this.stuckInputIntervalMs = options.hasPath("stuckInputIntervalMs") ? options.getLong("stuckInputIntervalMs") : 60_000L;
        this.stuckOperationIntervalMs = options.hasPath("stuckOperationIntervalMs") ? options.getLong("stuckOperationIntervalMs") : 30_000L;
        this.orphanSweepIntervalMs = options.hasPath("orphanSweepIntervalMs") ? options.getLong("orphanSweepIntervalMs") : 0L;
    }

    @Override
    protected void logStarted() {
        log.info("{} started: stuck inputs every {}ms, stuck operations every {}ms, orphans {}", serviceName,
            stuckInputIntervalMs, stuckOperationIntervalMs,
            orphanSweepIntervalMs > 0 ? "every " + orphanSweepIntervalMs + "ms" : "on demand only");
    }

    @Override
    protected void run() throws InterruptedException {
        final RecoverySweeper sweeper = getRequiredResource("worlds", WorldRegistry.class).getSweeper();
        final long tickMs = smallestInterval();
        if (tickMs == 0) {
            log.info("{} has no scheduled sweeps, idling", serviceName);
        }
        long nextStuckInputs = System.currentTimeMillis() + stuckInputIntervalMs;
        long nextStuckOperations = System.currentTimeMillis() + stuckOperationIntervalMs;
        long nextOrphans = System.currentTimeMillis() + orphanSweepIntervalMs;

        while (!Thread.currentThread().isInterrupted()) {
            checkPause();
            final long now = System.currentTimeMillis();
            if (stuckInputIntervalMs > 0 && now >= nextStuckInputs) {
                runPass(() -> sweeper.sweepStuckInputs(null), inputsCleared);
                nextStuckInputs = now + stuckInputIntervalMs;
            }
            if (stuckOperationIntervalMs > 0 && now >= nextStuckOperations) {
                runPass(sweeper::sweepStuckOperations, operationsCleared);
                nextStuckOperations = now + stuckOperationIntervalMs;
            }
            if (orphanSweepIntervalMs > 0 && now >= nextOrphans) {
                runPass(sweeper::sweepOrphans, orphansRepaired);
                nextOrphans = now + orphanSweepIntervalMs;
            }
            Thread.sleep(tickMs > 0 ? Math.min(tickMs, 1000L) : 1000L);
        }
    }

    private void runPass(final Supplier<SweepReport> pass, final AtomicLong counter) {
        try {
            final SweepReport report = pass.get();
            passes.incrementAndGet();
            counter.addAndGet(report.count());
            if (report.count() > 0) {
                log.info("Sweep '{}' repaired {} item(s)", report.sweep(), report.count());
            }
        } catch (final RuntimeException e) {
            log.warn("Sweep pass failed: {}", e.getMessage());
            log.debug("Sweep failure details:", e);
            recordError("SWEEP_FAILED", "Sweep pass failed", e.toString());
        }
    }

    private long smallestInterval() {
        long min = 0;
        for (final long interval : new long[]{stuckInputIntervalMs, stuckOperationIntervalMs, orphanSweepIntervalMs}) {
            if (interval > 0 && (min == 0 || interval < min)) {
                min = interval;
            }
        }
        return min;
    }

    @Override
    protected void addCustomMetrics(final Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("sweep_passes", passes.get());
        metrics.put("inputs_cleared", inputsCleared.get());
        metrics.put("operations_cleared", operationsCleared.get());
        metrics.put("orphans_repaired", orphansRepaired.get());
    }
}
