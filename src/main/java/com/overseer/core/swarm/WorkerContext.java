package com.overseer.core.swarm;

import com.overseer.core.model.AgentTask;
import com.overseer.core.model.VerificationVerdict;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-worker handle shared between a worker and the coordinator. The worker reads its
 * assignment and writes progress; the coordinator reads progress and may cancel.
 */
public class WorkerContext {

    private final String requestId;
    private final String workerId;
    private final AgentTask task;
    private final String note;
    private final VerificationVerdict failure;
    private final boolean conservationMode;
    private final AtomicLong lastProgressNanos = new AtomicLong(System.nanoTime());
    private final AtomicLong logChars = new AtomicLong();
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public WorkerContext(String requestId, String workerId, AgentTask task, String note,
                         VerificationVerdict failure, boolean conservationMode) {
        this.requestId = requestId;
        this.workerId = workerId;
        this.task = task;
        this.note = note;
        this.failure = failure;
        this.conservationMode = conservationMode;
    }

    public String requestId() {
        return requestId;
    }

    public String workerId() {
        return workerId;
    }

    public AgentTask task() {
        return task;
    }

    /**
     * Replacement or fix note, {@code null} for a first-attempt worker.
     */
    public String note() {
        return note;
    }

    /**
     * Verification failure a targeted-fix worker must address, {@code null} otherwise.
     */
    public VerificationVerdict failure() {
        return failure;
    }

    /**
     * When true the coordinator will not read resources back; the worker's summary must
     * carry everything the caller needs.
     */
    public boolean conservationMode() {
        return conservationMode;
    }

    public boolean isFix() {
        return failure != null;
    }

    /** Heartbeat. */
    public void reportProgress() {
        lastProgressNanos.set(System.nanoTime());
    }

    /**
     * Heartbeat carrying log output; the output volume feeds context-pressure monitoring.
     */
    public void reportProgress(String message) {
        if (message != null) {
            logChars.addAndGet(message.length());
        }
        reportProgress();
    }

    public boolean isCancelled() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }

    void cancel() {
        cancelled.set(true);
    }

    Duration sinceLastProgress() {
        return Duration.ofNanos(System.nanoTime() - lastProgressNanos.get());
    }

    long logChars() {
        return logChars.get();
    }
}
