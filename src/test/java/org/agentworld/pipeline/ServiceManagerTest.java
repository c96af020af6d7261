package org.agentworld.pipeline;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;
import org.agentworld.junit.extensions.logging.AllowLog;
import org.agentworld.junit.extensions.logging.ExpectLog;
import org.agentworld.junit.extensions.logging.LogLevel;
import org.agentworld.junit.extensions.logging.LogWatchExtension;
import org.agentworld.pipeline.api.resources.IResource;
import org.agentworld.pipeline.api.resources.ResourceContext;
import org.agentworld.pipeline.api.services.IService;
import org.agentworld.pipeline.api.services.ResourceBinding;
import org.agentworld.pipeline.api.services.ServiceStatus;
import org.agentworld.pipeline.resources.WorldRegistry;
import org.agentworld.runtime.engine.InputReceipt;
import org.agentworld.runtime.engine.WorldEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
@AllowLog(level = LogLevel.INFO, loggerPattern = ".*")
public class ServiceManagerTest {

    private ServiceManager sm;

    @AfterEach
    void tearDown() {
        if (sm != null) {
            sm.shutdown();
        }
    }

    private static Config createTestConfig(String extraResources, String extraServices) {
        return ConfigFactory.parseString(String.format("""
            pipeline {
              autoStart = false
              startupSequence = ["world-engine", "recovery-sweeper", "instance-health"]
              resources {
                worlds {
                  className = "org.agentworld.pipeline.resources.WorldRegistry"
                  options {
                    grid { width = 8, height = 8 }
                    engine { stepIntervalMs = 20 }
                    instances { initializeDefault = false }
                    store { type = "memory" }
                  }
                }
                %s
              }
              services {
                world-engine {
                  className = "org.agentworld.pipeline.services.world.WorldEngineService"
                  resources { worlds = "engine:worlds" }
                  options { workerThreads = 2 }
                }
                recovery-sweeper {
                  className = "org.agentworld.pipeline.services.world.RecoverySweeperService"
                  resources { worlds = "sweeper:worlds" }
                  options { stuckInputIntervalMs = 50, stuckOperationIntervalMs = 50 }
                }
                instance-health {
                  className = "org.agentworld.pipeline.services.world.InstanceHealthService"
                  resources { worlds = "monitor:worlds" }
                  options { intervalMs = 50 }
                }
                %s
              }
            }
        """, extraResources, extraServices));
    }

    private static Config createTestConfig() {
        return createTestConfig("", "");
    }

    @Test
    void testInitialization() {
        sm = new ServiceManager(createTestConfig());

        assertEquals(3, sm.getAllServiceStatus().size());
        assertEquals(1, sm.getMetrics().get("resources_total"));
        assertEquals(3L, sm.getMetrics().get("services_stopped"));
        assertEquals(IService.State.STOPPED, sm.getServiceStatus("world-engine").state());
        assertTrue(sm.getAllServices().isEmpty());
        assertTrue(sm.isHealthy());
    }

    @Test
    void testLifecycleMethods() {
        sm = new ServiceManager(createTestConfig());

        sm.startAll();
        await().atMost(2, TimeUnit.SECONDS).untilAsserted(() -> {
            assertEquals(IService.State.RUNNING, sm.getServiceStatus("world-engine").state());
            assertEquals(IService.State.RUNNING, sm.getServiceStatus("recovery-sweeper").state());
            assertEquals(3L, sm.getMetrics().get("services_running"));
        });
        assertThrows(IllegalStateException.class, () -> sm.startService("world-engine"));

        sm.pauseAll();
        assertEquals(IService.State.PAUSED, sm.getServiceStatus("world-engine").state());
        assertEquals(3L, sm.getMetrics().get("services_paused"));
        assertThrows(IllegalStateException.class, () -> sm.pauseService("world-engine"));

        sm.resumeAll();
        assertEquals(IService.State.RUNNING, sm.getServiceStatus("instance-health").state());
        assertThrows(IllegalStateException.class, () -> sm.resumeService("world-engine"));

        sm.stopAll();
        assertEquals(IService.State.STOPPED, sm.getServiceStatus("world-engine").state());
        assertEquals(IService.State.STOPPED, sm.getServiceStatus("instance-health").state());
        assertEquals(3L, sm.getMetrics().get("services_stopped"));

        // a stopped service can be started again as a fresh instance
        sm.restartService("world-engine");
        assertEquals(IService.State.RUNNING, sm.getServiceStatus("world-engine").state());
    }

    @Test
    void testWorldEngineServiceStepsWorlds() {
        sm = new ServiceManager(createTestConfig());
        WorldRegistry worlds = sm.getResource("worlds", WorldRegistry.class);
        WorldEngine engine = worlds.getEngine(worlds.createWorld());
        InputReceipt receipt = engine.submit("join", JsonNodeFactory.instance.objectNode().put("name", "Ann"));

        sm.startService("world-engine");

        await().atMost(3, TimeUnit.SECONDS).untilAsserted(() ->
            assertNotNull(engine.findInput(receipt.inputNumber()).orElseThrow().outcome()));
        assertEquals(1, engine.snapshot().state().players().size());
        await().atMost(2, TimeUnit.SECONDS).untilAsserted(() ->
            assertTrue(sm.getServiceStatus("world-engine").metrics().get("inputs_applied").longValue() >= 1));
    }

    @Test
    void testResourceBindingsAreReported() {
        sm = new ServiceManager(createTestConfig());
        sm.startService("recovery-sweeper");

        ServiceStatus status = sm.getServiceStatus("recovery-sweeper");
        assertEquals(1, status.resourceBindings().size());
        ResourceBinding binding = status.resourceBindings().get(0);
        assertEquals("worlds", binding.context().portName());
        assertEquals("sweeper", binding.context().usageType());
        assertEquals("worlds", binding.resource().getResourceName());
        assertEquals(IResource.UsageState.ACTIVE, binding.usageState());
        assertEquals(1L, sm.getMetrics().get("resources_active"));
    }

    @Test
    void testUnknownServicesAndResources() {
        sm = new ServiceManager(createTestConfig());

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> sm.stopService("nope"));
        assertEquals("Service not found: nope", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> sm.startService("nope"));
        assertThrows(IllegalArgumentException.class, () -> sm.getServiceStatus("nope"));
        assertThrows(IllegalArgumentException.class, () -> sm.getResource("nope", WorldRegistry.class));
        assertThrows(IllegalArgumentException.class, () -> sm.getResource("worlds", String.class));
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Failed to instantiate resource 'broken'.*")
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Failed to build service 'dangling'.*")
    void testBrokenDefinitionsAreSkipped() {
        sm = new ServiceManager(createTestConfig(
            "broken { className = \"org.agentworld.pipeline.resources.DoesNotExist\" }",
            "dangling { className = \"org.agentworld.pipeline.services.world.WorldEngineService\", resources { worlds = \"broken\" } }"));

        assertEquals(3, sm.getAllServiceStatus().size());
        assertEquals(1, sm.getAllResources().size());
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Could not perform action on service 'world-engine'.*")
    void testBulkActionsContinueAfterFailures() {
        sm = new ServiceManager(createTestConfig());
        sm.startService("world-engine");

        // world-engine is already running, the others still start
        sm.startAll();

        assertEquals(IService.State.RUNNING, sm.getServiceStatus("recovery-sweeper").state());
        assertEquals(IService.State.RUNNING, sm.getServiceStatus("instance-health").state());
    }

    @Test
    void testAutoStartRunsStartupSequence() {
        sm = new ServiceManager(createTestConfig().withValue("pipeline.autoStart", ConfigValueFactory.fromAnyRef(true)));

        assertEquals(IService.State.RUNNING, sm.getServiceStatus("world-engine").state());
        assertEquals(3, sm.getAllServices().size());
    }

    @Test
    void testParseResourceUri() {
        ResourceContext plain = ServiceManager.parseResourceUri("worlds", "svc", "port");
        assertNull(plain.usageType());
        assertEquals("worlds", plain.resourceName());
        assertTrue(plain.parameters().isEmpty());

        ResourceContext full = ServiceManager.parseResourceUri("engine:worlds?window=5&mode=fast", "svc", "port");
        assertEquals("engine", full.usageType());
        assertEquals("worlds", full.resourceName());
        assertEquals("5", full.parameters().get("window"));
        assertEquals("fast", full.parameters().get("mode"));
        assertEquals("svc", full.serviceName());
        assertEquals("port", full.portName());
    }

    @Test
    void testMissingPipelineSectionIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ServiceManager(ConfigFactory.empty()));
    }
}
