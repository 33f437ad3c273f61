package com.overseer.core.hooks;

/**
 * Attribute keys the engine puts into a {@link HookContext}.
 */
public final class HookAttributes {

    // ON_REQUEST_SUBMIT
    public static final String REQUEST = "request";
    public static final String FILE_HINTS = "fileHints";
    public static final String WORKFLOW_CLASS = "workflowClass";
    public static final String TIER = "tier";

    // ON_RESOURCE_MUTATED
    public static final String PHASE = "phase";
    public static final String TASK_ID = "taskId";
    public static final String WORKER_ID = "workerId";
    public static final String RESOURCES = "resources";

    // ON_WORKFLOW_STOP
    public static final String STATUS = "status";
    public static final String MODIFIED_COUNT = "modifiedCount";
    public static final String ERROR_COUNT = "errorCount";
    public static final String WARNING_COUNT = "warningCount";

    private HookAttributes() {}
}
