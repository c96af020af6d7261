package org.agentworld.pipeline;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;
import org.agentworld.pipeline.api.resources.IMonitorable;
import org.agentworld.pipeline.api.resources.IResource;
import org.agentworld.pipeline.api.resources.OperationalError;
import org.agentworld.pipeline.api.resources.ResourceContext;
import org.agentworld.pipeline.api.services.IService;
import org.agentworld.pipeline.api.services.IServiceFactory;
import org.agentworld.pipeline.api.services.ResourceBinding;
import org.agentworld.pipeline.api.services.ServiceStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds the resources and services declared in the {@code pipeline} configuration section and
 * manages the services' lifecycle.
 *
 * <pre>
 * pipeline {
 *   autoStart = true
 *   startupSequence = ["world-engine", "recovery-sweeper"]
 *   resources {
 *     worlds { className = "org.agentworld.pipeline.resources.WorldRegistry", options { ... } }
 *   }
 *   services {
 *     world-engine {
 *       className = "org.agentworld.pipeline.services.world.WorldEngineService"
 *       resources { worlds = "worlds" }
 *       options { workerThreads = 4 }
 *     }
 *   }
 * }
 * </pre>
 *
 * Resources are created once and live until {@link #shutdown()}. Services are created from their
 * factory on every start, so a stopped or failed service can be started again.
 */
public class ServiceManager implements IMonitorable {

    private static final Logger log = LoggerFactory.getLogger(ServiceManager.class);

    private final Map<String, IServiceFactory> serviceFactories = new LinkedHashMap<>();
    private final Map<String, IService> services = new ConcurrentHashMap<>();
    private final Map<String, IResource> resources = new LinkedHashMap<>();
    private final Map<String, List<ResourceContext>> serviceBindingContexts = new HashMap<>();
    private final Map<String, List<ResourceBinding>> serviceResourceBindings = new ConcurrentHashMap<>();
    private final List<String> startupSequence;

    public ServiceManager(final Config rootConfig) {
        if (!rootConfig.hasPath("pipeline")) {
            throw new IllegalArgumentException("Configuration must contain a 'pipeline' section");
        }
        final Config pipelineConfig = rootConfig.getConfig("pipeline");
        log.info("Initializing ServiceManager...");

        instantiateResources(pipelineConfig);
        buildServiceFactories(pipelineConfig);
        this.startupSequence = pipelineConfig.hasPath("startupSequence")
            ? pipelineConfig.getStringList("startupSequence")
            : Collections.emptyList();

        log.info("ServiceManager initialized with {} resources and {} services.", resources.size(), serviceFactories.size());

        final boolean autoStart = !pipelineConfig.hasPath("autoStart") || pipelineConfig.getBoolean("autoStart");
        if (autoStart && !startupSequence.isEmpty()) {
            log.info("\u001B[34m═══════════════════════════ Service Startup ═══════════════════════════\u001B[0m");
            startAll();
        } else if (!autoStart) {
            log.info("Auto-start is disabled. Services must be started via the API.");
        } else {
            log.info("No startup sequence defined. Services must be started via the API.");
        }
    }

    private void instantiateResources(final Config config) {
        if (!config.hasPath("resources")) {
            log.debug("No resources configured.");
            return;
        }
        final Config resourcesConfig = config.getConfig("resources");
        for (final String resourceName : resourcesConfig.root().keySet()) {
            try {
                final Config definition = resourcesConfig.getConfig(resourceName);
                final String className = definition.getString("className");
                final Config options = definition.hasPath("options") ? definition.getConfig("options") : ConfigFactory.empty();
                final IResource resource = (IResource) Class.forName(className)
                    .getConstructor(String.class, Config.class)
                    .newInstance(resourceName, options);
                resources.put(resourceName, resource);
                log.info("Instantiated resource '{}' ({})", resourceName, resource.getClass().getSimpleName());
            } catch (final Exception e) {
                final Throwable cause = rootCause(e);
                log.error("Failed to instantiate resource '{}': {}. Skipping this resource.", resourceName, cause.getMessage());
                log.debug("Resource failure details:", e);
            }
        }
    }

    private void buildServiceFactories(final Config config) {
        if (!config.hasPath("services")) {
            log.debug("No services configured.");
            return;
        }
        final Config servicesConfig = config.getConfig("services");
        for (final String serviceName : servicesConfig.root().keySet()) {
            try {
                final Config definition = servicesConfig.getConfig(serviceName);
                final String className = definition.getString("className");
                final Config options = definition.hasPath("options") ? definition.getConfig("options") : ConfigFactory.empty();

                final List<ResourceContext> contexts = new ArrayList<>();
                if (definition.hasPath("resources")) {
                    for (final Map.Entry<String, ConfigValue> entry : definition.getConfig("resources").root().entrySet()) {
                        final ResourceContext context = parseResourceUri(entry.getValue().unwrapped().toString(), serviceName, entry.getKey());
                        if (!resources.containsKey(context.resourceName())) {
                            throw new IllegalArgumentException(String.format("Service '%s' references unknown resource '%s' on port '%s'",
                                serviceName, context.resourceName(), context.portName()));
                        }
                        contexts.add(context);
                    }
                }

                final Constructor<?> constructor = Class.forName(className).getConstructor(String.class, Config.class, Map.class);
                final Map<String, List<IResource>> injected = new HashMap<>();
                for (final ResourceContext context : contexts) {
                    injected.computeIfAbsent(context.portName(), k -> new ArrayList<>()).add(resources.get(context.resourceName()));
                }
                final Map<String, List<IResource>> injectable = Collections.unmodifiableMap(injected);

                serviceBindingContexts.put(serviceName, List.copyOf(contexts));
                serviceFactories.put(serviceName, () -> {
                    try {
                        return (IService) constructor.newInstance(serviceName, options, injectable);
                    } catch (final InvocationTargetException e) {
                        throw new IllegalStateException("Failed to create service '" + serviceName + "': "
                            + rootCause(e).getMessage(), e.getCause());
                    } catch (final ReflectiveOperationException e) {
                        throw new IllegalStateException("Failed to create service '" + serviceName + "'", e);
                    }
                });
                log.debug("Built factory for service '{}' ({})", serviceName, className);
            } catch (final Exception e) {
                log.error("Failed to build service '{}': {}. Skipping this service.", serviceName, e.getMessage());
                log.debug("Service failure details:", e);
            }
        }
    }

    /**
     * Parses {@code "usageType:resourceName?key=value&..."}. The usage type and the parameters are optional.
     */
    static ResourceContext parseResourceUri(final String uri, final String serviceName, final String portName) {
        final String[] mainParts = uri.split(":", 2);
        final String usageType = mainParts.length == 2 ? mainParts[0] : null;
        final String[] resourceAndParams = (mainParts.length == 2 ? mainParts[1] : uri).split("\\?", 2);
        final Map<String, String> params = new HashMap<>();
        if (resourceAndParams.length > 1) {
            Arrays.stream(resourceAndParams[1].split("&"))
                .map(p -> p.split("=", 2))
                .filter(p -> p.length == 2)
                .forEach(p -> params.put(p[0], p[1]));
        }
        return new ResourceContext(serviceName, portName, usageType, resourceAndParams[0], Collections.unmodifiableMap(params));
    }

    private void applyToAllServices(final Consumer<String> action, final List<String> serviceNames) {
        for (final String serviceName : serviceNames) {
            try {
                action.accept(serviceName);
            } catch (final IllegalStateException | IllegalArgumentException e) {
                log.warn("Could not perform action on service '{}': {}", serviceName, e.getMessage());
            }
        }
    }

    /**
     * Starts the services of the startup sequence, in order.
     */
    public void startAll() {
        applyToAllServices(this::startService, new ArrayList<>(startupSequence));
    }

    /**
     * Stops all running or paused services in reverse startup order. Resources stay open so
     * services can be started again.
     */
    public void stopAll() {
        log.info("\u001B[34m═══════════════════════════ Stopping Services ═══════════════════════════\u001B[0m");
        final List<String> toStop = new ArrayList<>(startupSequence);
        Collections.reverse(toStop);
        services.keySet().stream().filter(s -> !toStop.contains(s)).sorted().forEach(toStop::add);
        final List<String> stoppable = toStop.stream()
            .filter(name -> {
                final IService service = services.get(name);
                return service != null
                    && (service.getCurrentState() == IService.State.RUNNING || service.getCurrentState() == IService.State.PAUSED);
            })
            .collect(Collectors.toList());
        applyToAllServices(this::stopService, stoppable);
    }

    /**
     * Stops all services and closes all closeable resources. The manager is unusable afterwards.
     */
    public void shutdown() {
        stopAll();
        closeAllResources();
    }

    private void closeAllResources() {
        for (final Map.Entry<String, IResource> entry : resources.entrySet()) {
            if (entry.getValue() instanceof AutoCloseable closeable) {
                try {
                    closeable.close();
                    log.info("Closed resource '{}'", entry.getKey());
                } catch (final Exception e) {
                    log.error("Failed to close resource '{}': {}", entry.getKey(), e.getMessage());
                }
            }
        }
    }

    public void pauseAll() {
        log.info("Pausing all services...");
        applyToAllServices(this::pauseService, new ArrayList<>(services.keySet()));
    }

    public void resumeAll() {
        log.info("Resuming all services...");
        applyToAllServices(this::resumeService, new ArrayList<>(services.keySet()));
    }

    public void restartAll() {
        log.info("Restarting all services...");
        stopAll();
        startAll();
    }

    /**
     * Creates a fresh instance of the service and starts it. A previous instance in STOPPED or
     * ERROR is discarded.
     *
     * @throws IllegalArgumentException if the service is not defined.
     * @throws IllegalStateException    if the service is running or paused, or cannot be created.
     */
    public synchronized void startService(final String name) {
        final IService existing = services.get(name);
        if (existing != null) {
            final IService.State state = existing.getCurrentState();
            if (state != IService.State.STOPPED && state != IService.State.ERROR) {
                throw new IllegalStateException("Service '" + name + "' is already running (state: " + state + ")");
            }
            log.debug("Discarding previous instance of service '{}' (state: {})", name, state);
            services.remove(name);
            serviceResourceBindings.remove(name);
        }

        final IServiceFactory factory = serviceFactories.get(name);
        if (factory == null) {
            throw new IllegalArgumentException("Service '" + name + "' is not defined.");
        }

        final IService instance = factory.create();
        final List<ResourceBinding> bindings = serviceBindingContexts.getOrDefault(name, List.of()).stream()
            .map(context -> new ResourceBinding(context, instance, resources.get(context.resourceName())))
            .collect(Collectors.toList());
        services.put(name, instance);
        serviceResourceBindings.put(name, Collections.unmodifiableList(bindings));
        try {
            instance.start();
        } catch (final RuntimeException e) {
            services.remove(name);
            serviceResourceBindings.remove(name);
            log.error("Failed to start service '{}': {}", name, e.getMessage());
            throw e;
        }
    }

    /**
     * Stops the service and waits for it. The stopped instance is kept for status reporting.
     *
     * @throws IllegalArgumentException if the service has no instance.
     */
    public void stopService(final String name) {
        stopAndAwait(getServiceOrFail(name), name);
    }

    public void pauseService(final String serviceName) {
        getServiceOrFail(serviceName).pause();
    }

    public void resumeService(final String serviceName) {
        getServiceOrFail(serviceName).resume();
    }

    public void restartService(final String serviceName) {
        log.info("Restarting service '{}'...", serviceName);
        final IService service = services.get(serviceName);
        if (service != null
            && (service.getCurrentState() == IService.State.RUNNING || service.getCurrentState() == IService.State.PAUSED)) {
            stopService(serviceName);
        }
        startService(serviceName);
    }

    private void stopAndAwait(final IService service, final String serviceName) {
        log.info("Stopping service '{}'...", serviceName);
        service.stop();
        if (service.getCurrentState() != IService.State.STOPPED) {
            log.warn("Service '{}' did not stop cleanly (state: {})", serviceName, service.getCurrentState());
        }
    }

    private IService getServiceOrFail(final String serviceName) {
        final IService service = services.get(serviceName);
        if (service == null) {
            throw new IllegalArgumentException("Service not found: " + serviceName);
        }
        return service;
    }

    /**
     * Returns a configured resource by name.
     *
     * @throws IllegalArgumentException if no such resource exists or it is not a {@code T}.
     */
    public <T> T getResource(final String name, final Class<T> type) {
        final IResource resource = resources.get(name);
        if (resource == null) {
            throw new IllegalArgumentException("Resource not found: " + name);
        }
        if (!type.isInstance(resource)) {
            throw new IllegalArgumentException("Resource '" + name + "' is a " + resource.getClass().getName()
                + ", not a " + type.getName());
        }
        return type.cast(resource);
    }

    public Collection<IService> getAllServices() {
        return Collections.unmodifiableCollection(services.values());
    }

    @Override
    public Map<String, Number> getMetrics() {
        final Map<String, Number> metrics = new LinkedHashMap<>();
        final Map<IService.State, Long> states = services.values().stream()
            .collect(Collectors.groupingBy(IService::getCurrentState, Collectors.counting()));
        final long neverStarted = serviceFactories.size() - services.size();

        metrics.put("services_total", (long) serviceFactories.size());
        metrics.put("services_running", states.getOrDefault(IService.State.RUNNING, 0L));
        metrics.put("services_paused", states.getOrDefault(IService.State.PAUSED, 0L));
        metrics.put("services_stopped", states.getOrDefault(IService.State.STOPPED, 0L) + neverStarted);
        metrics.put("services_error", states.getOrDefault(IService.State.ERROR, 0L));

        final Map<IResource.UsageState, Long> usage = serviceResourceBindings.values().stream()
            .flatMap(List::stream)
            .map(ResourceBinding::usageState)
            .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
        metrics.put("resources_total", resources.size());
        metrics.put("resources_active", usage.getOrDefault(IResource.UsageState.ACTIVE, 0L));
        metrics.put("resources_waiting", usage.getOrDefault(IResource.UsageState.WAITING, 0L));
        metrics.put("resources_failed", usage.getOrDefault(IResource.UsageState.FAILED, 0L));
        return Collections.unmodifiableMap(metrics);
    }

    @Override
    public List<OperationalError> getErrors() {
        return services.values().stream()
            .flatMap(s -> s.getErrors().stream())
            .collect(Collectors.toList());
    }

    @Override
    public void clearErrors() {
        services.values().forEach(IService::clearErrors);
        log.info("Cleared errors of all services.");
    }

    @Override
    public boolean isHealthy() {
        final boolean servicesOk = services.values().stream().noneMatch(s -> s.getCurrentState() == IService.State.ERROR);
        final boolean resourcesOk = serviceResourceBindings.values().stream()
            .flatMap(List::stream)
            .noneMatch(b -> b.usageState() == IResource.UsageState.FAILED);
        return servicesOk && resourcesOk;
    }

    public Map<String, ServiceStatus> getAllServiceStatus() {
        return serviceFactories.keySet().stream()
            .collect(Collectors.toMap(Function.identity(), this::getServiceStatus, (a, b) -> a, LinkedHashMap::new));
    }

    public Map<String, IResource> getAllResources() {
        return Collections.unmodifiableMap(resources);
    }

    /**
     * @throws IllegalArgumentException if the service is not defined.
     */
    public ServiceStatus getServiceStatus(final String serviceName) {
        if (!serviceFactories.containsKey(serviceName)) {
            throw new IllegalArgumentException("Service not found: " + serviceName);
        }
        final IService service = services.get(serviceName);
        if (service == null) {
            return new ServiceStatus(IService.State.STOPPED, true, Collections.emptyMap(), Collections.emptyList(), Collections.emptyList());
        }
        final boolean monitorable = service instanceof IMonitorable;
        return new ServiceStatus(
            service.getCurrentState(),
            monitorable ? ((IMonitorable) service).isHealthy() : service.getCurrentState() != IService.State.ERROR,
            monitorable ? ((IMonitorable) service).getMetrics() : Collections.emptyMap(),
            service.getErrors(),
            serviceResourceBindings.getOrDefault(serviceName, Collections.emptyList()));
    }

    private static Throwable rootCause(final Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause;
    }
}
