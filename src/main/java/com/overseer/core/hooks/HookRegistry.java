package com.overseer.core.hooks;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hooks per lifecycle point, ordered by priority with ties broken by registration order.
 */
@Component
public class HookRegistry {

    private static final Logger log = LoggerFactory.getLogger(HookRegistry.class);

    private final Map<LifecyclePoint, List<Registration>> registrations = new EnumMap<>(LifecyclePoint.class);
    private final AtomicLong sequence = new AtomicLong();

    public HookRegistry() {
    }

    @Autowired
    public HookRegistry(List<HookProvider> providers) {
        for (HookProvider provider : providers) {
            provider.registerHooks(this);
        }
    }

    public synchronized void register(LifecyclePoint point, Hook hook) {
        registrations.computeIfAbsent(point, k -> new ArrayList<>())
                .add(new Registration(hook, sequence.incrementAndGet()));
        log.info("Registered hook '{}' at {} (priority {})", hook.name(), point, hook.priority());
    }

    /**
     * Hooks registered at {@code point}, sorted by ascending priority then registration order.
     */
    public synchronized List<Hook> hooksFor(LifecyclePoint point) {
        return registrations.getOrDefault(point, List.of()).stream()
                .sorted(Comparator.comparingInt((Registration r) -> r.hook().priority())
                        .thenComparingLong(Registration::sequence))
                .map(Registration::hook)
                .toList();
    }

    public synchronized int size() {
        return registrations.values().stream().mapToInt(List::size).sum();
    }

    private record Registration(Hook hook, long sequence) {}
}
