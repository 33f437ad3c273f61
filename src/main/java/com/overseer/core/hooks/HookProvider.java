package com.overseer.core.hooks;

/**
 * Contributes hook registrations. Every Spring bean implementing this interface is
 * picked up by the {@link HookRegistry} at startup.
 */
public interface HookProvider {

    void registerHooks(HookRegistry registry);
}
