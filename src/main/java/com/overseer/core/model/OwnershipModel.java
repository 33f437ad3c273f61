package com.overseer.core.model;

public enum OwnershipModel {
    SINGLE_AGENT,
    PARALLEL_SWARM
}
