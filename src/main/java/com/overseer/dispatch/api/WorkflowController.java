package com.overseer.dispatch.api;

import com.overseer.core.engine.Orchestrator;
import com.overseer.core.model.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;

/**
 * REST controller for workflow lifecycle operations.
 */
@RestController
@RequestMapping("/api/v1/workflows")
public class WorkflowController {

    private static final Logger log = LoggerFactory.getLogger(WorkflowController.class);

    private final Orchestrator orchestrator;
    private final SseStreamingService sseStreamingService;

    public WorkflowController(Orchestrator orchestrator, SseStreamingService sseStreamingService) {
        this.orchestrator = orchestrator;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/workflows: Submit a new request. Runs asynchronously.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> submit(@RequestBody WorkflowRequest body) {
        if (body.request() == null || body.request().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Request text is required"));
        }
        Request request = body.toRequest();
        String requestId = orchestrator.generateRequestId();
        log.info("Accepted workflow {}, launching async execution", requestId);

        CompletableFuture.runAsync(() -> {
            try {
                orchestrator.run(requestId, request);
            } catch (RuntimeException e) {
                log.error("Workflow {} failed", requestId, e);
            }
        });

        return ResponseEntity.accepted().body(Map.of(
                "request_id", requestId,
                "status", "SUBMITTED"));
    }

    /**
     * GET /api/v1/workflows: List all tracked workflows.
     */
    @GetMapping
    public ResponseEntity<List<WorkflowResponse>> list() {
        return ResponseEntity.ok(orchestrator.reports().stream()
                .map(WorkflowResponse::from)
                .toList());
    }

    /**
     * GET /api/v1/workflows/{id}: Current report for one workflow.
     */
    @GetMapping("/{id}")
    public ResponseEntity<WorkflowResponse> get(@PathVariable String id) {
        return orchestrator.report(id)
                .map(r -> ResponseEntity.ok(WorkflowResponse.from(r)))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * GET /api/v1/workflows/{id}/events: SSE stream of real-time workflow events.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable String id) {
        if (orchestrator.report(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(id));
    }

    /**
     * POST /api/v1/workflows/{id}/confirm: Confirm the phase awaiting a human and continue.
     */
    @PostMapping("/{id}/confirm")
    public ResponseEntity<WorkflowResponse> confirm(@PathVariable String id,
                                                    @RequestBody(required = false) ConfirmationRequest body) {
        String operator = body != null ? body.operator() : null;
        return ResponseEntity.ok(WorkflowResponse.from(orchestrator.confirm(id, operator)));
    }

    /**
     * POST /api/v1/workflows/{id}/acknowledge: Release a completion held by a stop hook.
     */
    @PostMapping("/{id}/acknowledge")
    public ResponseEntity<WorkflowResponse> acknowledge(@PathVariable String id,
                                                        @RequestBody(required = false) ConfirmationRequest body) {
        String operator = body != null ? body.operator() : null;
        return ResponseEntity.ok(WorkflowResponse.from(orchestrator.acknowledge(id, operator)));
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<Map<String, String>> notFound(NoSuchElementException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, String>> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
