package com.overseer.core.swarm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ContextPressureMonitorTest {

    private static ContextPressureMonitor monitor() {
        return new ContextPressureMonitor(3, 5, 100, 20, 8);
    }

    @Test
    @DisplayName("Crossing the iteration threshold enters conservation mode once")
    void iterationThreshold() {
        var monitor = monitor();
        monitor.recordIteration();
        monitor.recordIteration();
        assertFalse(monitor.checkThresholds());

        monitor.recordIteration();
        assertTrue(monitor.checkThresholds());
        assertTrue(monitor.conservationMode());
        assertTrue(monitor.conservationReason().startsWith("iteration count 3"));
        assertFalse(monitor.checkThresholds());
    }

    @Test
    @DisplayName("Spawned workers and log volume are thresholds too")
    void otherThresholds() {
        var spawns = monitor();
        for (int i = 0; i < 5; i++) {
            spawns.recordSpawn();
        }
        assertTrue(spawns.checkThresholds());
        assertTrue(spawns.conservationReason().contains("spawned workers"));

        var logs = monitor();
        logs.recordLog(-50);
        logs.recordLog(100);
        assertEquals(100, logs.logChars());
        assertTrue(logs.checkThresholds());
        assertTrue(logs.conservationReason().contains("log volume"));
    }

    @Test
    @DisplayName("Summaries shrink further once conservation mode is on")
    void compress() {
        var monitor = monitor();
        String summary = "a".repeat(30);
        assertEquals(20, monitor.compress(summary).length());
        assertTrue(monitor.compress(summary).endsWith("..."));
        assertEquals("short", monitor.compress("short"));
        assertEquals("", monitor.compress(null));

        for (int i = 0; i < 3; i++) {
            monitor.recordIteration();
        }
        monitor.checkThresholds();
        assertEquals("aaaaa...", monitor.compress(summary));
    }
}
