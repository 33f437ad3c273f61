package com.overseer.dispatch.api;

import com.overseer.core.events.EventBus;
import com.overseer.core.events.OverseerEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link SseStreamingService}.
 */
class SseStreamingServiceTest {

    private EventBus eventBus;
    private SseStreamingService service;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        service = new SseStreamingService(eventBus);
    }

    @Nested
    @DisplayName("createEmitter")
    class CreateEmitterTests {

        @Test
        @DisplayName("creates a non-null emitter for a workflow")
        void createsNonNullEmitter() {
            SseEmitter emitter = service.createEmitter("OVSR-2026-0001");
            assertNotNull(emitter);
            assertEquals(1, service.activeEmitterCount());
        }

        @Test
        @DisplayName("multiple emitters can be created for the same workflow")
        void multipleEmittersForSameWorkflow() {
            SseEmitter first = service.createEmitter("OVSR-2026-0001");
            SseEmitter second = service.createEmitter("OVSR-2026-0001");
            assertNotSame(first, second);
            assertEquals(2, service.activeEmitterCount());
        }

        @Test
        @DisplayName("uses the configured timeout")
        void configuredTimeout() {
            var shortLived = new SseStreamingService(eventBus, 1_000L);
            assertEquals(1_000L, shortLived.createEmitter("OVSR-2026-0001").getTimeout());
        }
    }

    @Nested
    @DisplayName("event forwarding")
    class ForwardingTests {

        @Test
        @DisplayName("publishing for a streamed workflow does not disturb other subscribers")
        void publishReachesOtherSubscribers() {
            service.createEmitter("OVSR-2026-0001");
            List<OverseerEvent> received = new ArrayList<>();
            eventBus.subscribe("OVSR-2026-0001", received::add);

            eventBus.publish(OverseerEvent.of("phase.started", "OVSR-2026-0001", null, Map.of("phase", "plan")));
            eventBus.publish(OverseerEvent.of("worker.spawned", "OVSR-2026-0001", "implement-1",
                    Map.of("workerId", "w-1")));

            assertEquals(2, received.size());
            assertEquals("implement-1", received.get(1).taskId());
        }

        @Test
        @DisplayName("events for other workflows are ignored")
        void otherWorkflowsIgnored() {
            service.createEmitter("OVSR-2026-0001");
            assertDoesNotThrow(() -> eventBus.publish(
                    OverseerEvent.of("phase.started", "OVSR-2026-0002", null, Map.of())));
            assertEquals(1, service.activeEmitterCount());
        }
    }

    @Test
    @DisplayName("heartbeats tolerate emitters that are not yet attached to a response")
    void heartbeatsDoNotThrow() {
        service.createEmitter("OVSR-2026-0001");
        service.createEmitter("OVSR-2026-0002");
        assertDoesNotThrow(() -> service.sendHeartbeats());
    }

    @Test
    @DisplayName("heartbeat scheduler starts and stops cleanly")
    void heartbeatLifecycle() {
        service.startHeartbeat();
        assertDoesNotThrow(() -> service.stopHeartbeat());
    }
}
