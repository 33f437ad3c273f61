package com.overseer.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for workflow progress events.
 * <p>
 * Supports per-workflow subscriptions and global subscriptions that receive all events.
 * A failing subscriber never affects publishers or other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-workflow subscribers keyed by requestId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<OverseerEvent>>> workflowSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<OverseerEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(OverseerEvent event) {
        log.debug("Publishing event: {} for workflow {}", event.eventType(), event.requestId());

        List<Consumer<OverseerEvent>> subs = workflowSubscribers.get(event.requestId());
        if (subs != null) {
            for (Consumer<OverseerEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<OverseerEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events of one workflow.
     *
     * @return a handle to cancel the subscription
     */
    public Subscription subscribe(String requestId, Consumer<OverseerEvent> consumer) {
        workflowSubscribers.computeIfAbsent(requestId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to workflow {}", requestId);
        return () -> {
            CopyOnWriteArrayList<Consumer<OverseerEvent>> subs = workflowSubscribers.get(requestId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    workflowSubscribers.remove(requestId, subs);
                }
            }
        };
    }

    public Subscription subscribeAll(Consumer<OverseerEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<OverseerEvent> subscriber, OverseerEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
