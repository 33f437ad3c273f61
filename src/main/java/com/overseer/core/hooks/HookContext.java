package com.overseer.core.hooks;

import com.overseer.core.session.SessionState;

import java.util.Map;

/**
 * Input passed to hooks.
 *
 * @param requestId  workflow the dispatch belongs to
 * @param attributes point-specific data (request text, mutated resources, final status, ...)
 * @param session    the session state, read-only from the hook's point of view; hooks change it
 *                   only by returning a state patch
 */
public record HookContext(
    LifecyclePoint point,
    String requestId,
    Map<String, Object> attributes,
    SessionState session
) {

    public HookContext {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public String attribute(String key) {
        Object value = attributes.get(key);
        return value != null ? value.toString() : null;
    }
}
