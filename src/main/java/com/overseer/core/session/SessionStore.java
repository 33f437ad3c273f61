package com.overseer.core.session;

import com.overseer.core.model.Request;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory, session-scoped store: the shared {@link SessionState}, per-request history records
 * and the workflow outcome tracker. Nothing survives a restart.
 */
@Component
public class SessionStore {

    private final SessionState state = new SessionState();
    private final OutcomeTracker outcomes = new OutcomeTracker();
    private final ConcurrentHashMap<String, SessionRecord> records = new ConcurrentHashMap<>();

    public SessionState state() {
        return state;
    }

    public OutcomeTracker outcomes() {
        return outcomes;
    }

    public SessionRecord create(String requestId, Request request) {
        var record = new SessionRecord(requestId, request);
        records.put(requestId, record);
        return record;
    }

    public Optional<SessionRecord> find(String requestId) {
        return Optional.ofNullable(records.get(requestId));
    }

    public Collection<SessionRecord> all() {
        return List.copyOf(records.values());
    }
}
