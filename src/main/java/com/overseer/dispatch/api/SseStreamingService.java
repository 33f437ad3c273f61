package com.overseer.dispatch.api;

import com.overseer.core.events.EventBus;
import com.overseer.core.events.OverseerEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter} instances.
 * <p>
 * Each connected client gets an emitter subscribed to one workflow's events. Subscriptions
 * are released when the emitter completes, times out or errors. Idle connections receive
 * a heartbeat comment so proxies keep them open.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Workflows can park waiting for confirmation, so emitters live for an hour. */
    private static final long DEFAULT_TIMEOUT_MS = 60 * 60 * 1000L;
    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final long timeoutMs;
    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
        log.debug("SSE heartbeat scheduler started (interval={}s)", HEARTBEAT_INTERVAL_SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException e) {
                // onError/onCompletion callbacks clean up
                log.debug("Heartbeat failed for workflow {}: {}", registration.requestId, e.getMessage());
            } catch (IllegalStateException e) {
                log.debug("Heartbeat skipped for workflow {} (emitter not active)", registration.requestId);
            }
        }
    }

    /**
     * Creates an SSE emitter that streams events for the given workflow.
     */
    public SseEmitter createEmitter(String requestId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        EventBus.Subscription subscription = eventBus.subscribe(requestId, event -> sendEvent(emitter, event));
        var registration = new EmitterRegistration(requestId, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> cleanup(registration));
        emitter.onError(ex -> {
            log.debug("SSE emitter error for workflow {}: {}", requestId, ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial heartbeat for workflow {}: {}", requestId, e.getMessage());
        }
        log.info("SSE emitter created for workflow {} (timeout={}ms)", requestId, timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendEvent(SseEmitter emitter, OverseerEvent event) {
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("requestId", event.requestId());
            if (event.taskId() != null) {
                data.put("taskId", event.taskId());
            }
            data.putAll(event.payload());
            data.put("timestamp", event.timestamp().toString());
            emitter.send(SseEmitter.event().name(event.eventType()).data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for workflow {}: {}",
                    event.eventType(), event.requestId(), e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        activeRegistrations.remove(registration);
        log.debug("Cleaned up SSE registration for workflow {}", registration.requestId);
    }

    private record EmitterRegistration(
            String requestId,
            SseEmitter emitter,
            EventBus.Subscription subscription
    ) {}
}
