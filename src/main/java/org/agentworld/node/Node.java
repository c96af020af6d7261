package org.agentworld.node;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import org.agentworld.node.spi.IProcess;
import org.agentworld.node.spi.IServiceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A running agent-world node: instantiates the processes declared under {@code node.processes},
 * starts them in dependency order and stops them in reverse order.
 *
 * <pre>
 * node.processes {
 *   pipeline { className = "org.agentworld.pipeline.ServiceManagerProcess", options { ... } }
 *   http {
 *     className = "org.agentworld.node.processes.http.HttpServerProcess"
 *     require { serviceManager = "pipeline" }
 *     options { ... }
 *   }
 * }
 * </pre>
 *
 * A process named in {@code require} is instantiated first and whatever it exposes through
 * {@link IServiceProvider} is passed to the requiring process under the local name.
 */
public final class Node {

    private static final Logger LOGGER = LoggerFactory.getLogger(Node.class);

    private final Map<String, IProcess> managedProcesses = new LinkedHashMap<>();
    private Thread shutdownHook;

    /**
     * @throws IllegalStateException if the process graph is invalid.
     */
    public Node(final Config config) {
        try {
            initializeProcesses(config);
        } catch (final RuntimeException e) {
            LOGGER.error("Failed to initialize the node: {}", e.getMessage());
            throw new IllegalStateException("Node initialization failed", e);
        }
    }

    /**
     * Starts all processes and registers a shutdown hook that stops them.
     */
    public void start() {
        if (managedProcesses.isEmpty()) {
            LOGGER.warn("No processes configured. The node will be idle.");
        }
        managedProcesses.forEach((name, process) -> {
            try {
                process.start();
                LOGGER.debug("Process '{}' started.", name);
            } catch (final RuntimeException e) {
                LOGGER.error("Failed to start process '{}': {}", name, e.getMessage());
                LOGGER.debug("Process start failure details:", e);
            }
        });
        shutdownHook = new Thread(this::stop, "shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        LOGGER.info("Node started with {} process(es).", managedProcesses.size());
    }

    /**
     * Stops all processes, last started first.
     */
    public void stop() {
        LOGGER.info("Shutdown sequence initiated...");
        if (shutdownHook != null && Thread.currentThread() != shutdownHook) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (final IllegalStateException e) {
                LOGGER.debug("Shutdown hook already running: {}", e.getMessage());
            }
        }
        final List<String> names = new ArrayList<>(managedProcesses.keySet());
        Collections.reverse(names);
        for (final String name : names) {
            try {
                managedProcesses.get(name).stop();
                LOGGER.debug("Process '{}' stopped.", name);
            } catch (final RuntimeException e) {
                LOGGER.error("Error while stopping process '{}': {}", name, e.getMessage());
                LOGGER.debug("Process stop failure details:", e);
            }
        }
        LOGGER.info("All processes stopped.");
    }

    /**
     * @return The process registered under {@code name}, or {@code null}.
     */
    public IProcess getProcess(final String name) {
        return managedProcesses.get(name);
    }

    private void initializeProcesses(final Config config) {
        if (!config.hasPath("node.processes")) {
            LOGGER.warn("Configuration path 'node.processes' not found. No processes will be loaded.");
            return;
        }
        final ConfigObject processesConfig = config.getObject("node.processes");
        final Map<String, ProcessDefinition> definitions = new LinkedHashMap<>();
        for (final String processName : processesConfig.keySet()) {
            final Config processConfig = processesConfig.toConfig().getConfig(processName);
            final Map<String, String> requires = new LinkedHashMap<>();
            if (processConfig.hasPath("require")) {
                final Config requireConfig = processConfig.getConfig("require");
                for (final String localName : requireConfig.root().keySet()) {
                    requires.put(localName, requireConfig.getString(localName));
                }
            }
            definitions.put(processName, new ProcessDefinition(
                processName,
                processConfig.getString("className"),
                processConfig.hasPath("options") ? processConfig.getConfig("options") : ConfigFactory.empty(),
                requires));
        }

        final Map<String, Object> exposed = new HashMap<>();
        for (final String processName : dependencyOrder(definitions)) {
            final ProcessDefinition definition = definitions.get(processName);
            final Map<String, Object> injected = new HashMap<>();
            definition.requires().forEach((localName, source) -> {
                final Object service = exposed.get(source);
                if (service == null) {
                    throw new IllegalStateException("Process '" + processName + "' requires '" + source
                        + "', which did not expose a service");
                }
                injected.put(localName, service);
            });

            final IProcess process = instantiate(definition, injected);
            managedProcesses.put(processName, process);
            if (process instanceof IServiceProvider provider && provider.getExposedService() != null) {
                exposed.put(processName, provider.getExposedService());
            }
            LOGGER.debug("Initialized process '{}' ({})", processName, definition.className());
        }
        LOGGER.info("Initialized {} process(es): {}", managedProcesses.size(), managedProcesses.keySet());
    }

    private static IProcess instantiate(final ProcessDefinition definition, final Map<String, Object> dependencies) {
        try {
            final Class<?> processClass = Class.forName(definition.className());
            if (!IProcess.class.isAssignableFrom(processClass)) {
                throw new IllegalArgumentException("Class " + definition.className() + " does not implement IProcess");
            }
            final Constructor<?> constructor = processClass.getConstructor(String.class, Map.class, Config.class);
            return (IProcess) constructor.newInstance(definition.name(), dependencies, definition.options());
        } catch (final ReflectiveOperationException e) {
            final Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalStateException("Cannot create process '" + definition.name() + "': " + cause.getMessage(), cause);
        }
    }

    /**
     * Orders the processes so that every process comes after the processes it requires.
     * Declaration order is kept where the dependencies allow it.
     *
     * @throws IllegalStateException on unknown or circular requirements.
     */
    static List<String> dependencyOrder(final Map<String, ProcessDefinition> definitions) {
        final Map<String, Integer> inDegree = new LinkedHashMap<>();
        final Map<String, Set<String>> dependents = new HashMap<>();
        for (final ProcessDefinition definition : definitions.values()) {
            inDegree.putIfAbsent(definition.name(), 0);
            for (final String required : definition.requires().values()) {
                if (!definitions.containsKey(required)) {
                    throw new IllegalStateException("Process '" + definition.name() + "' requires '" + required
                        + "', which is not configured");
                }
                dependents.computeIfAbsent(required, k -> new LinkedHashSet<>()).add(definition.name());
                inDegree.merge(definition.name(), 1, Integer::sum);
            }
        }

        final Deque<String> ready = new ArrayDeque<>();
        inDegree.forEach((name, degree) -> {
            if (degree == 0) {
                ready.add(name);
            }
        });
        final List<String> ordered = new ArrayList<>();
        while (!ready.isEmpty()) {
            final String current = ready.poll();
            ordered.add(current);
            for (final String dependent : dependents.getOrDefault(current, Set.of())) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (ordered.size() != definitions.size()) {
            final List<String> cyclic = new ArrayList<>(definitions.keySet());
            cyclic.removeAll(ordered);
            throw new IllegalStateException("Circular dependency among processes: " + cyclic);
        }
        return ordered;
    }

    record ProcessDefinition(String name, String className, Config options, Map<String, String> requires) {
    }
}
