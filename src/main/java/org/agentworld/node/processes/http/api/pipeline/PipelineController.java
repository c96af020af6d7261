package org.agentworld.node.processes.http.api.pipeline;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import io.javalin.openapi.HttpMethod;
import io.javalin.openapi.OpenApi;
import io.javalin.openapi.OpenApiContent;
import io.javalin.openapi.OpenApiParam;
import io.javalin.openapi.OpenApiResponse;
import org.agentworld.node.processes.http.AbstractController;
import org.agentworld.node.processes.http.api.dto.ErrorResponseDto;
import org.agentworld.node.processes.http.api.dto.MessageResponseDto;
import org.agentworld.node.processes.http.api.pipeline.dto.PipelineStatusDto;
import org.agentworld.node.processes.http.api.pipeline.dto.ResourceStatusDto;
import org.agentworld.node.processes.http.api.pipeline.dto.ServiceStatusDto;
import org.agentworld.node.spi.ServiceRegistry;
import org.agentworld.pipeline.ServiceManager;
import org.agentworld.pipeline.api.services.IService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.function.Consumer;

/**
 * Lifecycle control and monitoring of the pipeline services.
 */
public class PipelineController extends AbstractController {

    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineController.class);

    private final ServiceManager serviceManager;
    private final String nodeId;

    public PipelineController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        this.serviceManager = registry.get(ServiceManager.class);
        this.nodeId = options.hasPath("nodeId") ? options.getString("nodeId") : determineNodeId();
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.get(path(basePath, "/status"), this::getPipelineStatus);
        app.post(path(basePath, "/start"), ctx -> handleLifecycleCommand(ctx, serviceManager::startAll));
        app.post(path(basePath, "/stop"), ctx -> handleLifecycleCommand(ctx, serviceManager::stopAll));
        app.post(path(basePath, "/restart"), ctx -> handleLifecycleCommand(ctx, serviceManager::restartAll));
        app.post(path(basePath, "/pause"), ctx -> handleLifecycleCommand(ctx, serviceManager::pauseAll));
        app.post(path(basePath, "/resume"), ctx -> handleLifecycleCommand(ctx, serviceManager::resumeAll));

        final String servicePath = path(basePath, "/service/{serviceName}");
        app.get(servicePath + "/status", this::getServiceStatus);
        app.post(servicePath + "/start", ctx -> handleServiceCommand(ctx, serviceManager::startService));
        app.post(servicePath + "/stop", ctx -> handleServiceCommand(ctx, serviceManager::stopService));
        app.post(servicePath + "/restart", ctx -> handleServiceCommand(ctx, serviceManager::restartService));
        app.post(servicePath + "/pause", ctx -> handleServiceCommand(ctx, serviceManager::pauseService));
        app.post(servicePath + "/resume", ctx -> handleServiceCommand(ctx, serviceManager::resumeService));
        registerExceptionHandlers(app);
    }

    @OpenApi(
        path = "status",
        methods = {HttpMethod.GET},
        summary = "Get pipeline status",
        description = "Returns the state, metrics and errors of all services and resources",
        tags = {"pipeline"},
        responses = {@OpenApiResponse(status = "200", content = @OpenApiContent(from = PipelineStatusDto.class))}
    )
    void getPipelineStatus(final Context ctx) {
        final List<ServiceStatusDto> services = serviceManager.getAllServiceStatus().entrySet().stream()
            .map(e -> ServiceStatusDto.from(e.getKey(), e.getValue()))
            .toList();
        final List<ResourceStatusDto> resources = serviceManager.getAllResources().entrySet().stream()
            .map(e -> ResourceStatusDto.from(e.getKey(), e.getValue()))
            .toList();
        ctx.status(HttpStatus.OK).json(new PipelineStatusDto(nodeId, overallStatus(services), serviceManager.isHealthy(),
            serviceManager.getMetrics(), services, resources));
    }

    @OpenApi(
        path = "service/{serviceName}/status",
        methods = {HttpMethod.GET},
        summary = "Get service status",
        tags = {"pipeline"},
        pathParams = {@OpenApiParam(name = "serviceName", description = "Name of the service", required = true)},
        responses = {
            @OpenApiResponse(status = "200", content = @OpenApiContent(from = ServiceStatusDto.class)),
            @OpenApiResponse(status = "404", description = "Service not found", content = @OpenApiContent(from = ErrorResponseDto.class))
        }
    )
    void getServiceStatus(final Context ctx) {
        final String serviceName = ctx.pathParam("serviceName");
        ctx.status(HttpStatus.OK).json(ServiceStatusDto.from(serviceName, serviceManager.getServiceStatus(serviceName)));
    }

    private void handleLifecycleCommand(final Context ctx, final Runnable command) {
        command.run();
        ctx.status(HttpStatus.ACCEPTED).json(new MessageResponseDto("Request accepted."));
    }

    private void handleServiceCommand(final Context ctx, final Consumer<String> command) {
        final String serviceName = ctx.pathParam("serviceName");
        command.accept(serviceName);
        ctx.status(HttpStatus.ACCEPTED).json(new MessageResponseDto("Request for service '" + serviceName + "' accepted."));
    }

    private static String overallStatus(final List<ServiceStatusDto> services) {
        final long running = services.stream().filter(s -> s.state() == IService.State.RUNNING).count();
        if (running == 0) {
            return "IDLE";
        }
        return running == services.size() ? "RUNNING" : "DEGRADED";
    }

    private static String determineNodeId() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (final UnknownHostException e) {
            LOGGER.debug("Cannot resolve host name: {}", e.getMessage());
            return "unknown";
        }
    }
}
