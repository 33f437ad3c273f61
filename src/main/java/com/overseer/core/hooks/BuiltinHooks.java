package com.overseer.core.hooks;

import org.springframework.stereotype.Component;

/**
 * Registers the hooks that ship with the engine.
 */
@Component
public class BuiltinHooks implements HookProvider {

    @Override
    public void registerHooks(HookRegistry registry) {
        registry.register(LifecyclePoint.ON_REQUEST_SUBMIT, new SessionPatternHook());
        registry.register(LifecyclePoint.ON_WORKFLOW_STOP, new WorkflowDigestHook());
    }
}
