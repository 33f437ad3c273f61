package com.overseer.core.hooks;

public enum HookStatus {
    SUCCESS,
    FAILED,
    SKIPPED,
    TIMEOUT
}
