package com.overseer.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setRequest puts requestId in MDC")
    void setRequest() {
        MdcContext.setRequest("OVSR-2026-0001");
        assertEquals("OVSR-2026-0001", MDC.get("requestId"));
    }

    @Test
    @DisplayName("setWorker puts requestId, phase, taskId and workerId in MDC")
    void setWorker() {
        MdcContext.setWorker("OVSR-2026-0001", "implement", "implement-1", "implement-1.r1");
        assertEquals("OVSR-2026-0001", MDC.get("requestId"));
        assertEquals("implement", MDC.get("phase"));
        assertEquals("implement-1", MDC.get("taskId"));
        assertEquals("implement-1.r1", MDC.get("workerId"));
    }

    @Test
    @DisplayName("clearPhase keeps the request id")
    void clearPhase() {
        MdcContext.setWorker("OVSR-2026-0001", "implement", "implement-1", "implement-1");
        MdcContext.clearPhase();
        assertEquals("OVSR-2026-0001", MDC.get("requestId"));
        assertNull(MDC.get("phase"));
        assertNull(MDC.get("workerId"));
    }

    @Test
    @DisplayName("clear removes all overseer MDC keys")
    void clear() {
        MdcContext.setWorker("OVSR-2026-0001", "verify", "verify-1", "verify-1");
        MdcContext.clear();
        assertNull(MDC.get("requestId"));
        assertNull(MDC.get("phase"));
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("workerId"));
    }
}
