package com.unconference.backend.modules.schedule.domain;

public enum ViolationKind {
    DUPLICATE_SLOT,
    DUPLICATE_SESSION,
    BLOCKED_SLOT,
    DANGLING_REFERENCE
}
