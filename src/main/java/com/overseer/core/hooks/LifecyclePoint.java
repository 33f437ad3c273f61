package com.overseer.core.hooks;

/**
 * Extension points at which hooks run.
 */
public enum LifecyclePoint {
    ON_REQUEST_SUBMIT,
    ON_RESOURCE_MUTATED,
    ON_WORKFLOW_STOP
}
