package org.agentworld.node.processes;

import com.typesafe.config.Config;
import org.agentworld.node.spi.IProcess;

import java.util.Collections;
import java.util.Map;

/**
 * Base class of processes. Every process is constructed with its name, the objects exposed by
 * the processes it requires and its own options block.
 */
public abstract class AbstractProcess implements IProcess {

    protected final String processName;
    protected final Map<String, Object> dependencies;
    protected final Config options;

    protected AbstractProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        this.processName = processName;
        this.dependencies = dependencies != null ? dependencies : Collections.emptyMap();
        this.options = options;
    }

    public String getProcessName() {
        return processName;
    }

    /**
     * Returns a required dependency.
     *
     * @throws IllegalArgumentException if it is missing or not a {@code T}.
     */
    protected <T> T getDependency(final String name, final Class<T> expectedType) {
        final T dependency = getOptionalDependency(name, expectedType);
        if (dependency == null) {
            throw new IllegalArgumentException("Required dependency '" + name + "' not found for process '" + processName + "'");
        }
        return dependency;
    }

    /**
     * Returns an optional dependency, or {@code null}.
     *
     * @throws IllegalArgumentException if it is present but not a {@code T}.
     */
    protected <T> T getOptionalDependency(final String name, final Class<T> expectedType) {
        final Object dependency = dependencies.get(name);
        if (dependency == null) {
            return null;
        }
        if (!expectedType.isInstance(dependency)) {
            throw new IllegalArgumentException("Dependency '" + name + "' of process '" + processName + "' is a "
                + dependency.getClass().getName() + ", expected " + expectedType.getName());
        }
        return expectedType.cast(dependency);
    }
}
