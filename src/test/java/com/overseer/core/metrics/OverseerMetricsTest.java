package com.overseer.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OverseerMetricsTest {

    private SimpleMeterRegistry registry;
    private OverseerMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new OverseerMetrics(registry);
    }

    @Test
    @DisplayName("recordClassification counts per class and tier")
    void recordClassification() {
        metrics.recordClassification("DIRECT", "T0");
        metrics.recordClassification("DIRECT", "T0");
        metrics.recordClassification("PHASED", "T3");

        var direct = registry.find("overseer.classifications.total").tag("workflow", "DIRECT").counter();
        var phased = registry.find("overseer.classifications.total").tag("tier", "T3").counter();
        assertNotNull(direct);
        assertEquals(2.0, direct.count());
        assertEquals(1.0, phased.count());
    }

    @Test
    @DisplayName("recordPhaseDuration creates a timer per phase")
    void recordPhaseDuration() {
        metrics.recordPhaseDuration("implement", 1500);
        var timer = registry.find("overseer.phase.duration").tag("phase", "implement").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordFixWorker separates resolved and unresolved fixes")
    void recordFixWorker() {
        metrics.recordFixWorker(true);
        metrics.recordFixWorker(false);
        metrics.recordFixWorker(false);

        assertEquals(1.0, registry.find("overseer.workers.fix").tag("resolved", "true").counter().count());
        assertEquals(2.0, registry.find("overseer.workers.fix").tag("resolved", "false").counter().count());
    }

    @Test
    @DisplayName("stalls, budget actions and conservation are counted")
    void swarmCounters() {
        metrics.recordWorkerStall();
        metrics.recordBudgetAction("MERGED");
        metrics.recordConservationMode();
        metrics.recordWaveSize(4);

        assertEquals(1.0, registry.find("overseer.workers.stalled").counter().count());
        assertEquals(1.0, registry.find("overseer.budget.actions").tag("kind", "MERGED").counter().count());
        assertEquals(1.0, registry.find("overseer.conservation.entered").counter().count());
        assertEquals(4.0, registry.find("overseer.wave.workers").summary().totalAmount());
    }

    @Test
    @DisplayName("hook executions and workflow results are recorded")
    void hooksAndResults() {
        metrics.recordHookExecution("ON_REQUEST_SUBMIT", "SUCCESS", 12);
        metrics.recordWorkflowResult("ALL_PHASES_COMPLETED");

        assertEquals(1, registry.find("overseer.hook.duration").tag("point", "ON_REQUEST_SUBMIT").timer().count());
        assertEquals(1.0, registry.find("overseer.workflows.total")
                .tag("status", "ALL_PHASES_COMPLETED").counter().count());
    }
}
