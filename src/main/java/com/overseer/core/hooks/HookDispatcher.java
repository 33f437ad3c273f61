package com.overseer.core.hooks;

import com.overseer.core.config.OverseerProperties;
import com.overseer.core.metrics.OverseerMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the hooks registered at a lifecycle point.
 * <p>
 * Hooks execute one after another in registry order, each bounded by
 * {@code min(declared timeout, remaining budget)}. Faults and timeouts are captured as results
 * and never reach the caller. The returned list has one entry per registered hook; hooks whose
 * predicate declines, and hooks cut off by an exhausted aggregate budget, report
 * {@link HookStatus#SKIPPED}. Blocking stop hooks are exempt from budget truncation.
 * <p>
 * Once all hooks ran, state patches of successful results are merged into the session in
 * dispatch order, so later patches overwrite earlier values for the same key.
 * <p>
 * Hook bodies run on a pool of at most {@code overseer.hooks.max-threads} threads. A hook that
 * ignores cancellation keeps its thread; once all threads are held, further hooks fail fast
 * instead of growing the pool.
 */
@Service
public class HookDispatcher {

    private static final Logger log = LoggerFactory.getLogger(HookDispatcher.class);

    private final HookRegistry registry;
    private final Map<LifecyclePoint, Duration> budgets = new EnumMap<>(LifecyclePoint.class);
    private final Duration defaultTimeout;
    private final OverseerMetrics metrics;
    private final ExecutorService executor;

    @Autowired
    public HookDispatcher(HookRegistry registry, OverseerProperties properties,
                          @Autowired(required = false) OverseerMetrics metrics) {
        this(registry, properties.getHooks(), metrics);
    }

    HookDispatcher(HookRegistry registry, OverseerProperties.Hooks hooks, OverseerMetrics metrics) {
        this.registry = registry;
        this.budgets.put(LifecyclePoint.ON_REQUEST_SUBMIT, hooks.getSubmitBudget());
        this.budgets.put(LifecyclePoint.ON_RESOURCE_MUTATED, hooks.getMutationBudget());
        this.budgets.put(LifecyclePoint.ON_WORKFLOW_STOP, hooks.getStopBudget());
        this.defaultTimeout = hooks.getDefaultTimeout();
        this.metrics = metrics;
        var counter = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(0, Math.max(1, hooks.getMaxThreads()),
                30, TimeUnit.SECONDS, new SynchronousQueue<>(), r -> {
                    Thread t = new Thread(r, "hook-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
    }

    public List<HookResult> dispatch(LifecyclePoint point, HookContext context) {
        List<Hook> hooks = registry.hooksFor(point);
        var results = new ArrayList<HookResult>(hooks.size());
        long budgetMs = budgets.get(point).toMillis();
        long startNanos = System.nanoTime();

        for (Hook hook : hooks) {
            if (!predicateAllows(hook, context)) {
                results.add(HookResult.of(hook, point, HookStatus.SKIPPED, null, 0L));
                continue;
            }

            long timeoutMs = declaredTimeoutMs(hook);
            if (isPerCallBudget(point)) {
                timeoutMs = Math.min(timeoutMs, budgetMs);
            } else {
                long remaining = budgetMs - elapsedMs(startNanos);
                boolean exempt = point == LifecyclePoint.ON_WORKFLOW_STOP && hook.blocking();
                if (!exempt) {
                    if (remaining <= 0) {
                        log.info("Hook budget for {} exhausted; skipping '{}'", point, hook.name());
                        results.add(HookResult.of(hook, point, HookStatus.SKIPPED, "budget exhausted", 0L));
                        continue;
                    }
                    timeoutMs = Math.min(timeoutMs, remaining);
                }
            }
            results.add(execute(hook, point, context, timeoutMs));
        }

        mergePatches(results, context);
        return results;
    }

    private boolean predicateAllows(Hook hook, HookContext context) {
        try {
            return hook.shouldRun(context);
        } catch (RuntimeException e) {
            log.warn("Predicate of hook '{}' failed, skipping: {}", hook.name(), e.getMessage());
            return false;
        }
    }

    private HookResult execute(Hook hook, LifecyclePoint point, HookContext context, long timeoutMs) {
        long start = System.nanoTime();
        Future<HookResult> future;
        try {
            future = executor.submit(() -> hook.run(context));
        } catch (RejectedExecutionException e) {
            log.warn("No hook thread free for '{}' at {}; all threads are held by earlier hooks", hook.name(), point);
            HookResult rejected = HookResult.of(hook, point, HookStatus.FAILED, "hook executor saturated", 0L);
            if (metrics != null) {
                metrics.recordHookExecution(point.name(), rejected.status().name(), 0L);
            }
            return rejected;
        }
        HookResult result;
        try {
            HookResult raw = future.get(Math.max(1, timeoutMs), TimeUnit.MILLISECONDS);
            result = raw == null
                    ? HookResult.of(hook, point, HookStatus.FAILED, "hook returned no result", elapsedMs(start))
                    : raw.stamped(hook, point, elapsedMs(start));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Hook '{}' at {} timed out after {}ms", hook.name(), point, timeoutMs);
            result = HookResult.of(hook, point, HookStatus.TIMEOUT, "timed out after " + timeoutMs + "ms", elapsedMs(start));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Hook '{}' at {} failed: {}", hook.name(), point, cause.getMessage(), cause);
            result = HookResult.of(hook, point, HookStatus.FAILED, describe(cause), elapsedMs(start));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            result = HookResult.of(hook, point, HookStatus.FAILED, "interrupted", elapsedMs(start));
        }
        if (metrics != null) {
            metrics.recordHookExecution(point.name(), result.status().name(), result.durationMs());
        }
        return result;
    }

    private void mergePatches(List<HookResult> results, HookContext context) {
        if (context.session() == null) {
            return;
        }
        for (HookResult result : results) {
            if (result.succeeded() && !result.statePatch().isEmpty()) {
                long version = context.session().merge(result.statePatch());
                log.debug("Merged state patch from '{}' (session version {})", result.hookName(), version);
            }
        }
    }

    private long declaredTimeoutMs(Hook hook) {
        Duration declared = hook.timeout();
        return (declared != null ? declared : defaultTimeout).toMillis();
    }

    private static boolean isPerCallBudget(LifecyclePoint point) {
        return point == LifecyclePoint.ON_RESOURCE_MUTATED;
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }
}
