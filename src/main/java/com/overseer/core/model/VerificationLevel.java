package com.overseer.core.model;

public enum VerificationLevel {
    NONE,
    BASIC,
    FULL,
    FULL_SECURITY_ROLLBACK
}
