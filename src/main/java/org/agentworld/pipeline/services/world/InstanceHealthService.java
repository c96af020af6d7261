package org.agentworld.pipeline.services.world;

import com.typesafe.config.Config;
import org.agentworld.pipeline.api.resources.IResource;
import org.agentworld.pipeline.resources.WorldRegistry;
import org.agentworld.pipeline.services.AbstractService;
import org.agentworld.runtime.instances.ChannelHealth;
import org.agentworld.runtime.instances.InstanceManager;

import java.util.List;
import java.util.Map;

/**
 * Periodically evaluates the instance health report and logs instances that need attention.
 * Recommendations are logged, not applied.
 *
 * <h3>Configuration Options:</h3>
 * <ul>
 *   <li><b>intervalMs</b>: Period of the health check (default: 60000).</li>
 * </ul>
 */
public class InstanceHealthService extends AbstractService {

    private final long intervalMs;
    private volatile int instancesTotal;
    private volatile int instancesUnhealthy;
    private volatile long checksRun;

    public InstanceHealthService(final String name, final Config options, final Map<String, List<IResource>> resources) {
        super(name, options, resources);
        this.intervalMs = options.hasPath("intervalMs") ? options.getLong("intervalMs") : 60_000L;
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive, got " + intervalMs);
        }
    }

    @Override
    protected void run() throws InterruptedException {
        final InstanceManager instances = getRequiredResource("worlds", WorldRegistry.class).getInstanceManager();
        while (!Thread.currentThread().isInterrupted()) {
            checkPause();
            check(instances);
            Thread.sleep(intervalMs);
        }
    }

    private void check(final InstanceManager instances) {
        final List<ChannelHealth> report = instances.healthReport();
        int unhealthy = 0;
        for (final ChannelHealth health : report) {
            if (!health.healthy()) {
                unhealthy++;
                log.warn("Instance {} ({}) needs attention: {} -> {}", health.instanceId(), health.name(),
                    health.issues(), health.recommendations());
            }
        }
        instancesTotal = report.size();
        instancesUnhealthy = unhealthy;
        checksRun++;
        log.debug("Health check: {} instances, {} unhealthy", report.size(), unhealthy);
    }

    @Override
    protected void addCustomMetrics(final Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("instances_total", instancesTotal);
        metrics.put("instances_unhealthy", instancesUnhealthy);
        metrics.put("checks_run", checksRun);
    }
}
