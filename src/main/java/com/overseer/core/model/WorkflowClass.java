package com.overseer.core.model;

/**
 * Shape of a workflow plan selected by the request classifier.
 */
public enum WorkflowClass {
    /** Single-phase direct execution. */
    DIRECT,
    /** Fixed plan, implement, verify sequence. */
    STANDARD,
    /** Phase-based plan with checkpoints between phases to bound working context. */
    PHASED
}
