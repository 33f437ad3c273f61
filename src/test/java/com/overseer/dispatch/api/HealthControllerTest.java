package com.overseer.dispatch.api;

import com.overseer.core.health.HealthCheckService;
import com.overseer.core.health.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthCheckService healthCheckService;

    @Test
    @DisplayName("Degraded components still report 200")
    void degradedIsUp() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("graph", HealthStatus.Status.UP, "Graph compiled and available", Map.of()),
                new HealthStatus("hooks", HealthStatus.Status.DEGRADED, "No hooks registered", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.hooks.status").value("DEGRADED"));
    }

    @Test
    @DisplayName("A DOWN component turns the response into 503")
    void downIs503() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("workers", HealthStatus.Status.DOWN, "Worker pool shut down",
                        Map.of("activeWorkers", "0"))));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"))
                .andExpect(jsonPath("$.components.workers.metadata.activeWorkers").value("0"));
    }
}
