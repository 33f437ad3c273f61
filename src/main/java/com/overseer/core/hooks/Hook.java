package com.overseer.core.hooks;

import java.time.Duration;

/**
 * A callable bound to one {@link LifecyclePoint}. Lower priorities run first.
 */
public interface Hook {

    String name();

    default int priority() {
        return 100;
    }

    /**
     * Declared timeout; {@code null} uses the dispatcher default.
     */
    default Duration timeout() {
        return null;
    }

    /**
     * Only meaningful at {@link LifecyclePoint#ON_WORKFLOW_STOP}: an unsuccessful blocking hook
     * holds workflow completion until an operator acknowledges it.
     */
    default boolean blocking() {
        return false;
    }

    default boolean shouldRun(HookContext context) {
        return true;
    }

    HookResult run(HookContext context) throws Exception;
}
