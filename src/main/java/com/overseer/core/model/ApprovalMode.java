package com.overseer.core.model;

public enum ApprovalMode {
    AUTOMATIC,
    HUMAN_CONFIRMATION
}
