package com.overseer.core.model;

public enum ReviewType {
    SELF,
    PEER,
    SECURITY
}
