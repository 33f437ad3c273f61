package com.overseer.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for workflow orchestration.
 */
@Service
public class OverseerMetrics {

    private final MeterRegistry registry;

    public OverseerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordClassification(String workflowClass, String tier) {
        Counter.builder("overseer.classifications.total")
                .tag("workflow", workflowClass)
                .tag("tier", tier)
                .register(registry)
                .increment();
    }

    public void recordWorkflowResult(String status) {
        Counter.builder("overseer.workflows.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordPhaseDuration(String phase, long ms) {
        Timer.builder("overseer.phase.duration")
                .tag("phase", phase)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordHookExecution(String point, String status, long ms) {
        Timer.builder("overseer.hook.duration")
                .tag("point", point)
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records a worker replaced after missing its progress grace period.
     */
    public void recordWorkerStall() {
        Counter.builder("overseer.workers.stalled")
                .description("Workers replaced after stalling")
                .register(registry)
                .increment();
    }

    public void recordFixWorker(boolean resolved) {
        Counter.builder("overseer.workers.fix")
                .description("Targeted-fix workers spawned after verification failure")
                .tag("resolved", String.valueOf(resolved))
                .register(registry)
                .increment();
    }

    public void recordBudgetAction(String kind) {
        Counter.builder("overseer.budget.actions")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordConservationMode() {
        Counter.builder("overseer.conservation.entered")
                .register(registry)
                .increment();
    }

    public void recordWaveSize(int workers) {
        DistributionSummary.builder("overseer.wave.workers")
                .description("Workers launched per wave")
                .register(registry)
                .record(workers);
    }
}
