package org.agentworld.pipeline.services;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.agentworld.junit.extensions.logging.ExpectLog;
import org.agentworld.junit.extensions.logging.LogLevel;
import org.agentworld.junit.extensions.logging.LogWatchExtension;
import org.agentworld.pipeline.api.resources.IResource;
import org.agentworld.pipeline.api.resources.OperationalError;
import org.agentworld.pipeline.api.services.IService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
public class AbstractServiceTest {

    private Config config;
    private Map<String, List<IResource>> resources;

    @BeforeEach
    void setUp() {
        config = ConfigFactory.empty();
        resources = new HashMap<>();
    }

    private static class LoopingService extends AbstractService {
        private final AtomicInteger iterations = new AtomicInteger();
        private final AtomicBoolean wasInterrupted = new AtomicBoolean(false);
        volatile boolean isRunning = false;

        LoopingService(String name, Config options, Map<String, List<IResource>> resources) {
            super(name, options, resources);
        }

        @Override
        protected void run() throws InterruptedException {
            isRunning = true;
            try {
                while (!Thread.currentThread().isInterrupted()) {
                    checkPause();
                    iterations.incrementAndGet();
                    Thread.sleep(5);
                }
            } catch (InterruptedException e) {
                wasInterrupted.set(true);
                throw e;
            } finally {
                isRunning = false;
            }
        }

        @Override
        protected int getMaxErrors() {
            return 3;
        }

        @Override
        protected void addCustomMetrics(Map<String, Number> metrics) {
            super.addCustomMetrics(metrics);
            metrics.put("iterations", iterations.get());
        }

        void fail(String code) {
            recordError(code, "failed", "details");
        }
    }

    private static class CrashingService extends AbstractService {
        CrashingService(String name, Config options, Map<String, List<IResource>> resources) {
            super(name, options, resources);
        }

        @Override
        protected void run() {
            throw new IllegalStateException("world store unreachable");
        }
    }

    @Test
    void serviceStartsAndStopsCorrectly() {
        LoopingService service = new LoopingService("test-service", config, resources);
        assertEquals(IService.State.STOPPED, service.getCurrentState());

        service.start();
        await().atMost(2, TimeUnit.SECONDS).untilAsserted(() -> {
            assertEquals(IService.State.RUNNING, service.getCurrentState());
            assertTrue(service.isRunning);
        });

        service.stop();
        assertEquals(IService.State.STOPPED, service.getCurrentState());
        assertFalse(service.isRunning);
        assertTrue(service.wasInterrupted.get());
    }

    @Test
    void servicePausesAndResumesCorrectly() {
        LoopingService service = new LoopingService("test-service", config, resources);
        service.start();
        await().atMost(2, TimeUnit.SECONDS).until(() -> service.iterations.get() > 0);

        service.pause();
        assertEquals(IService.State.PAUSED, service.getCurrentState());
        // the loop blocks in checkPause at the next iteration
        await().pollDelay(50, TimeUnit.MILLISECONDS).atMost(2, TimeUnit.SECONDS).until(() -> {
            int before = service.iterations.get();
            Thread.sleep(30);
            return service.iterations.get() == before;
        });

        service.resume();
        int resumedAt = service.iterations.get();
        await().atMost(2, TimeUnit.SECONDS).until(() -> service.iterations.get() > resumedAt);

        service.stop();
        assertEquals(IService.State.STOPPED, service.getCurrentState());
    }

    @Test
    void stopWhilePausedReleasesTheWorker() {
        LoopingService service = new LoopingService("test-service", config, resources);
        service.start();
        service.pause();

        service.stop();

        assertEquals(IService.State.STOPPED, service.getCurrentState());
        assertFalse(service.isRunning);
    }

    @Test
    void restartMethodWorksCorrectly() {
        LoopingService service = new LoopingService("test-service", config, resources);
        service.start();
        await().atMost(2, TimeUnit.SECONDS).until(() -> service.isRunning);

        service.restart();
        await().atMost(2, TimeUnit.SECONDS).untilAsserted(() -> {
            assertEquals(IService.State.RUNNING, service.getCurrentState());
            assertTrue(service.isRunning);
        });

        service.stop();
    }

    @Test
    void invalidTransitionsAreRejected() {
        LoopingService service = new LoopingService("test-service", config, resources);
        assertThrows(IllegalStateException.class, service::stop);
        assertThrows(IllegalStateException.class, service::pause);
        assertThrows(IllegalStateException.class, service::resume);

        service.start();
        assertThrows(IllegalStateException.class, service::start);
        assertThrows(IllegalStateException.class, service::resume);
        service.stop();
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "crashing stopped with ERROR due to IllegalStateException: world store unreachable")
    void exceptionInRunMovesServiceToError() {
        CrashingService service = new CrashingService("crashing", config, resources);
        service.start();

        await().atMost(2, TimeUnit.SECONDS).untilAsserted(() -> assertEquals(IService.State.ERROR, service.getCurrentState()));
        assertFalse(service.isHealthy());
    }

    @Test
    void getRequiredResourceReturnsCorrectResource() {
        IResource mockResource = mock(IResource.class);
        resources.put("testPort", Collections.singletonList(mockResource));
        LoopingService service = new LoopingService("test-service", config, resources);

        IResource retrieved = service.getRequiredResource("testPort", IResource.class);
        assertSame(mockResource, retrieved);
        assertTrue(service.hasResource("testPort"));
        assertTrue(service.getOptionalResource("testPort", IResource.class).isPresent());
        assertTrue(service.getOptionalResource("otherPort", IResource.class).isEmpty());
    }

    @Test
    void getRequiredResourceThrowsWhenPortNotConfigured() {
        LoopingService service = new LoopingService("test-service", config, resources);
        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> service.getRequiredResource("missing", IResource.class));
        assertTrue(e.getMessage().contains("missing"));
    }

    @Test
    void getRequiredResourceThrowsWhenPortHasSeveralResources() {
        resources.put("testPort", List.of(mock(IResource.class), mock(IResource.class)));
        LoopingService service = new LoopingService("test-service", config, resources);

        assertThrows(IllegalStateException.class, () -> service.getRequiredResource("testPort", IResource.class));
    }

    @Test
    void getRequiredResourceThrowsOnTypeMismatch() {
        resources.put("testPort", List.of(mock(IResource.class)));
        LoopingService service = new LoopingService("test-service", config, resources);

        assertThrows(IllegalStateException.class, () -> service.getRequiredResource("testPort", TypedResource.class));
    }

    @Test
    void errorsAreBoundedAndReflectedInHealthAndMetrics() {
        LoopingService service = new LoopingService("test-service", config, resources);
        assertTrue(service.isHealthy());

        service.fail("A");
        service.fail("B");
        service.fail("C");
        service.fail("D");

        List<OperationalError> errors = service.getErrors();
        assertEquals(3, errors.size());
        assertEquals("B", errors.get(0).errorType());
        assertFalse(service.isHealthy());
        assertEquals(3, service.getMetrics().get("error_count").intValue());
        assertEquals(0, service.getMetrics().get("iterations").intValue());

        service.clearErrors();
        assertTrue(service.isHealthy());
    }

    private interface TypedResource extends IResource {
    }
}
