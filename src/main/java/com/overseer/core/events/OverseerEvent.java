package com.overseer.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during workflow execution, used for SSE streaming and CLI progress output.
 *
 * @param eventType event type (e.g. "workflow.submitted", "phase.completed", "worker.stalled")
 * @param requestId the workflow this event belongs to
 * @param taskId    the task this event relates to (nullable for workflow-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record OverseerEvent(
    String eventType,
    String requestId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static OverseerEvent of(String eventType, String requestId, String taskId, Map<String, Object> payload) {
        return new OverseerEvent(eventType, requestId, taskId, payload == null ? Map.of() : payload, Instant.now());
    }
}
