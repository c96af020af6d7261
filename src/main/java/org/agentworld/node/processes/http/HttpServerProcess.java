package org.agentworld.node.processes.http;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import io.javalin.Javalin;
import org.agentworld.node.processes.AbstractProcess;
import org.agentworld.node.spi.IController;
import org.agentworld.node.spi.ServiceRegistry;
import org.agentworld.pipeline.ServiceManager;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs the Javalin HTTP server. Controllers are mounted from the {@code routes} block: every
 * nested key adds a path segment and a {@code "$controller"} entry mounts a controller there.
 *
 * <pre>
 * options {
 *   network { host = "0.0.0.0", port = 8080 }
 *   resourceBindings { "org.agentworld.pipeline.resources.WorldRegistry" = "worlds" }
 *   routes {
 *     api.worlds { "$controller" { className = "org.agentworld.node.processes.http.api.world.WorldController" } }
 *   }
 * }
 * </pre>
 *
 * Requires the {@code serviceManager} dependency. Resources named in {@code resourceBindings} are
 * looked up in the service manager and handed to controllers through a {@link ServiceRegistry}.
 */
public class HttpServerProcess extends AbstractProcess {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpServerProcess.class);
    private static final String CONTROLLER_KEY = "$controller";

    private final ServiceRegistry controllerRegistry = new ServiceRegistry();
    private final List<ControllerRoute> controllerRoutes = new ArrayList<>();
    private Javalin app;

    public HttpServerProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        super(processName, dependencies, options);
        final ServiceManager serviceManager = getDependency("serviceManager", ServiceManager.class);
        controllerRegistry.register(ServiceManager.class, serviceManager);

        if (options.hasPath("resourceBindings")) {
            final ConfigObject bindings = options.getObject("resourceBindings");
            for (final String typeName : bindings.keySet()) {
                final String resourceName = bindings.get(typeName).unwrapped().toString();
                try {
                    final Class<?> type = Class.forName(typeName);
                    controllerRegistry.register(type, serviceManager.getResource(resourceName, type));
                    LOGGER.debug("Bound resource '{}' as {}", resourceName, type.getSimpleName());
                } catch (final ClassNotFoundException e) {
                    LOGGER.warn("Cannot bind resource '{}': class {} not found", resourceName, typeName);
                } catch (final IllegalArgumentException e) {
                    LOGGER.warn("Cannot bind resource '{}' as {}: {}", resourceName, typeName, e.getMessage());
                }
            }
        }

        if (options.hasPath("routes")) {
            collectRoutes(options.getObject("routes"), "/");
        } else {
            LOGGER.warn("No 'routes' block configured for '{}'. No controllers will be served.", processName);
        }
    }

    @Override
    public void start() {
        if (app != null) {
            LOGGER.warn("HTTP server '{}' is already running.", processName);
            return;
        }
        final String host = options.hasPath("network.host") ? options.getString("network.host") : "0.0.0.0";
        final int port = options.hasPath("network.port") ? options.getInt("network.port") : 8080;
        final int minThreads = options.hasPath("network.threadPool.minThreads") ? options.getInt("network.threadPool.minThreads") : 8;
        final int maxThreads = options.hasPath("network.threadPool.maxThreads") ? options.getInt("network.threadPool.maxThreads") : 200;
        final int idleTimeoutMs = options.hasPath("network.threadPool.idleTimeoutMs") ? options.getInt("network.threadPool.idleTimeoutMs") : 60000;

        app = Javalin.create(config -> {
            config.showJavalinBanner = false;
            config.requestLogger.http((ctx, ms) -> {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("{} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.statusCode(), ms);
                }
            });
            final QueuedThreadPool threadPool = new QueuedThreadPool(maxThreads, minThreads, idleTimeoutMs);
            threadPool.setName(processName);
            config.jetty.threadPool = threadPool;
        });

        for (final ControllerRoute route : controllerRoutes) {
            final IController controller = createController(route);
            controller.registerRoutes(app, route.basePath());
            LOGGER.debug("Mounted {} at {}", controller.getClass().getSimpleName(), route.basePath());
        }

        app.start(host, port);
        LOGGER.info("HTTP server started on {}:{}", host, app.port());
    }

    @Override
    public void stop() {
        if (app != null) {
            app.stop();
            app = null;
            LOGGER.info("HTTP server stopped.");
        }
    }

    /**
     * @return The bound port, or -1 if the server is not running.
     */
    public int getPort() {
        return app != null ? app.port() : -1;
    }

    private void collectRoutes(final ConfigObject level, final String currentPath) {
        for (final Map.Entry<String, ConfigValue> entry : level.entrySet()) {
            final ConfigValue value = entry.getValue();
            if (value.valueType() != ConfigValueType.OBJECT) {
                LOGGER.warn("Ignoring route entry '{}' at '{}': expected an object", entry.getKey(), currentPath);
                continue;
            }
            if (CONTROLLER_KEY.equals(entry.getKey())) {
                controllerRoutes.add(new ControllerRoute(currentPath, ((ConfigObject) value).toConfig()));
            } else {
                collectRoutes((ConfigObject) value, currentPath + entry.getKey() + "/");
            }
        }
    }

    private IController createController(final ControllerRoute route) {
        final String className = route.definition().getString("className");
        final Config controllerOptions = route.definition().hasPath("options")
            ? route.definition().getConfig("options")
            : ConfigFactory.empty();
        try {
            final Class<?> controllerClass = Class.forName(className);
            if (!IController.class.isAssignableFrom(controllerClass)) {
                throw new IllegalArgumentException("Class " + className + " does not implement IController");
            }
            final Constructor<?> constructor = controllerClass.getConstructor(ServiceRegistry.class, Config.class);
            return (IController) constructor.newInstance(controllerRegistry, controllerOptions);
        } catch (final ReflectiveOperationException e) {
            final Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalStateException("Cannot create controller " + className + " at " + route.basePath()
                + ": " + cause.getMessage(), cause);
        }
    }

    private record ControllerRoute(String basePath, Config definition) {
    }
}
