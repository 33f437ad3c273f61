package com.overseer.core.swarm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FailureTrackerTest {

    @Test
    @DisplayName("A single failure does not escalate, a second one does")
    void escalatesOnSecondFailure() {
        var tracker = new FailureTracker();
        tracker.recordFailure("a", "assertion failed");
        assertFalse(tracker.shouldEscalate("a"));

        tracker.recordFailure("a", "test failure");
        assertTrue(tracker.shouldEscalate("a"));
        assertEquals(2, tracker.failureCount("a"));
    }

    @Test
    @DisplayName("Unknown tasks have no failures")
    void unknownTask() {
        var tracker = new FailureTracker();
        assertEquals(0, tracker.failureCount("unknown"));
        assertFalse(tracker.shouldEscalate("unknown"));
    }

    @Test
    @DisplayName("Clearing history resets a task only")
    void clearHistory() {
        var tracker = new FailureTracker();
        tracker.recordFailure("a", null);
        tracker.recordFailure("b", "x");
        tracker.clearHistory("a");

        assertEquals(0, tracker.failureCount("a"));
        assertEquals(1, tracker.failureCount("b"));
    }
}
