package org.agentworld.pipeline;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.agentworld.node.processes.AbstractProcess;
import org.agentworld.node.spi.IServiceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Node process that owns the {@link ServiceManager}. Its options are the pipeline definition
 * ({@code resources}, {@code services}, {@code startupSequence}, {@code autoStart}). The manager is
 * exposed to processes that require this one.
 */
public class ServiceManagerProcess extends AbstractProcess implements IServiceProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServiceManagerProcess.class);

    private final ServiceManager serviceManager;

    public ServiceManagerProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        super(processName, dependencies, options);
        this.serviceManager = new ServiceManager(ConfigFactory.empty().withValue("pipeline", options.root()));
    }

    @Override
    public void start() {
        // services were auto-started by the ServiceManager if configured
        LOGGER.debug("Pipeline process '{}' started", processName);
    }

    @Override
    public void stop() {
        LOGGER.info("Stopping pipeline process '{}'...", processName);
        serviceManager.shutdown();
    }

    @Override
    public Object getExposedService() {
        return serviceManager;
    }
}
