package com.overseer.core.hooks;

import java.util.Map;

/**
 * Outcome of one hook execution. The dispatcher stamps name, point, blocking flag and duration.
 *
 * @param statePatch entries merged into the session state after all hooks at the point ran
 */
public record HookResult(
    String hookName,
    LifecyclePoint point,
    HookStatus status,
    HookPayload payload,
    String displayText,
    Map<String, Object> statePatch,
    boolean blocking,
    long durationMs,
    String error
) {

    public HookResult {
        payload = payload == null ? HookPayload.empty() : payload;
        statePatch = statePatch == null ? Map.of() : Map.copyOf(statePatch);
    }

    public static HookResult success(HookPayload payload) {
        return new HookResult(null, null, HookStatus.SUCCESS, payload, null, Map.of(), false, 0L, null);
    }

    public static HookResult failed(String error) {
        return new HookResult(null, null, HookStatus.FAILED, null, null, Map.of(), false, 0L, error);
    }

    public HookResult withDisplayText(String text) {
        return new HookResult(hookName, point, status, payload, text, statePatch, blocking, durationMs, error);
    }

    public HookResult withStatePatch(Map<String, Object> patch) {
        return new HookResult(hookName, point, status, payload, displayText, patch, blocking, durationMs, error);
    }

    HookResult stamped(Hook hook, LifecyclePoint at, long elapsedMs) {
        return new HookResult(hook.name(), at, status, payload, displayText, statePatch,
                hook.blocking(), elapsedMs, error);
    }

    static HookResult of(Hook hook, LifecyclePoint at, HookStatus status, String error, long elapsedMs) {
        return new HookResult(hook.name(), at, status, null, null, Map.of(), hook.blocking(), elapsedMs, error);
    }

    public boolean succeeded() {
        return status == HookStatus.SUCCESS;
    }

    /**
     * True when this result should hold workflow completion.
     */
    public boolean holdsCompletion() {
        return blocking && point == LifecyclePoint.ON_WORKFLOW_STOP && status != HookStatus.SUCCESS;
    }
}
