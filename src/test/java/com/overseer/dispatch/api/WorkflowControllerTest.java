package com.overseer.dispatch.api;

import com.overseer.core.engine.Orchestrator;
import com.overseer.core.model.PhaseStatus;
import com.overseer.core.model.RiskTier;
import com.overseer.core.model.WorkflowClass;
import com.overseer.core.model.WorkflowReport;
import com.overseer.core.model.WorkflowStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(WorkflowController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class WorkflowControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private Orchestrator orchestrator;

    @MockitoBean
    private SseStreamingService sseStreamingService;

    private static WorkflowReport report(String id, WorkflowStatus status) {
        var phases = new LinkedHashMap<String, PhaseStatus>();
        phases.put("plan", PhaseStatus.COMPLETED);
        phases.put("implement", status == WorkflowStatus.ALL_PHASES_COMPLETED
                ? PhaseStatus.COMPLETED : PhaseStatus.IN_PROGRESS);
        return new WorkflowReport(id, status, WorkflowClass.STANDARD, RiskTier.T3, phases,
                List.of("config/credentials.yml"), List.of(), List.of(), List.of(), 420L);
    }

    // ── POST /api/v1/workflows ───────────────────────────────────────

    @Test
    @DisplayName("POST /workflows returns 202 Accepted with request_id")
    void submitWorkflow() throws Exception {
        when(orchestrator.generateRequestId()).thenReturn("OVSR-2026-0001");

        mockMvc.perform(post("/api/v1/workflows")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"request": "Add retry to the API client", "file_hints": ["src/api/Client.java"]}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.request_id").value("OVSR-2026-0001"))
                .andExpect(jsonPath("$.status").value("SUBMITTED"));
    }

    @Test
    @DisplayName("POST /workflows with a blank request returns 400")
    void submitBlank() throws Exception {
        mockMvc.perform(post("/api/v1/workflows")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"request\": \"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(containsString("required")));

        verify(orchestrator, never()).generateRequestId();
    }

    // ── GET ──────────────────────────────────────────────────────────

    @Test
    @DisplayName("GET /workflows lists tracked workflows in snake_case")
    void listWorkflows() throws Exception {
        when(orchestrator.reports()).thenReturn(List.of(
                report("OVSR-2026-0001", WorkflowStatus.ALL_PHASES_COMPLETED),
                report("OVSR-2026-0002", WorkflowStatus.AWAITING_CONFIRMATION)));

        mockMvc.perform(get("/api/v1/workflows"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].request_id").value("OVSR-2026-0001"))
                .andExpect(jsonPath("$[0].workflow_class").value("STANDARD"))
                .andExpect(jsonPath("$[1].status").value("AWAITING_CONFIRMATION"));
    }

    @Test
    @DisplayName("GET /workflows/{id} returns the report")
    void getWorkflow() throws Exception {
        when(orchestrator.report("OVSR-2026-0001"))
                .thenReturn(Optional.of(report("OVSR-2026-0001", WorkflowStatus.ALL_PHASES_COMPLETED)));

        mockMvc.perform(get("/api/v1/workflows/OVSR-2026-0001"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tier").value("T3"))
                .andExpect(jsonPath("$.phases.implement").value("COMPLETED"))
                .andExpect(jsonPath("$.modified_resources[0]").value("config/credentials.yml"))
                .andExpect(jsonPath("$.elapsed_ms").value(420));
    }

    @Test
    @DisplayName("GET /workflows/{id} for an unknown id returns 404")
    void getUnknown() throws Exception {
        when(orchestrator.report("OVSR-2026-9999")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/workflows/OVSR-2026-9999"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /workflows/{id}/events for an unknown id returns 404")
    void eventsUnknown() throws Exception {
        when(orchestrator.report("OVSR-2026-9999")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/workflows/OVSR-2026-9999/events"))
                .andExpect(status().isNotFound());

        verify(sseStreamingService, never()).createEmitter(any());
    }

    // ── confirm / acknowledge ────────────────────────────────────────

    @Test
    @DisplayName("POST /workflows/{id}/confirm passes the operator and returns the new report")
    void confirm() throws Exception {
        when(orchestrator.confirm("OVSR-2026-0001", "alice"))
                .thenReturn(report("OVSR-2026-0001", WorkflowStatus.ALL_PHASES_COMPLETED));

        mockMvc.perform(post("/api/v1/workflows/OVSR-2026-0001/confirm")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"operator\": \"alice\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ALL_PHASES_COMPLETED"));
    }

    @Test
    @DisplayName("Confirming a workflow that is not waiting returns 409")
    void confirmConflict() throws Exception {
        when(orchestrator.confirm(eq("OVSR-2026-0001"), any()))
                .thenThrow(new IllegalStateException("Cannot confirm while workflow is RUNNING"));

        mockMvc.perform(post("/api/v1/workflows/OVSR-2026-0001/confirm"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value(containsString("RUNNING")));
    }

    @Test
    @DisplayName("Acknowledging an unknown workflow returns 404")
    void acknowledgeUnknown() throws Exception {
        when(orchestrator.acknowledge(eq("OVSR-2026-9999"), any()))
                .thenThrow(new NoSuchElementException("Unknown workflow OVSR-2026-9999"));

        mockMvc.perform(post("/api/v1/workflows/OVSR-2026-9999/acknowledge"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value(containsString("OVSR-2026-9999")));
    }
}
