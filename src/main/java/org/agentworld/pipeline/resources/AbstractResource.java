package org.agentworld.pipeline.resources;

import com.typesafe.config.Config;
import org.agentworld.pipeline.api.resources.IMonitorable;
import org.agentworld.pipeline.api.resources.IResource;
import org.agentworld.pipeline.api.resources.OperationalError;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Base class of resources: name, options and bounded error tracking.
 */
public abstract class AbstractResource implements IResource, IMonitorable {

    protected final String resourceName;
    protected final Config options;
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    protected AbstractResource(final String name, final Config options) {
        this.resourceName = Objects.requireNonNull(name, "Resource name cannot be null");
        this.options = Objects.requireNonNull(options, "Resource options cannot be null");
    }

    protected int getMaxErrors() {
        return 10000;
    }

    @Override
    public String getResourceName() {
        return resourceName;
    }

    public Config getOptions() {
        return options;
    }

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

    @Override
    public boolean isHealthy() {
        return errors.isEmpty();
    }

    @Override
    public final Map<String, Number> getMetrics() {
        final Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        addCustomMetrics(metrics);
        return metrics;
    }

    protected void addCustomMetrics(final Map<String, Number> metrics) {
        // no custom metrics by default
    }
}
