package com.unconference.backend.modules.schedule.domain;

import java.util.Objects;

/**
 * First broken invariant found by {@link AssignmentValidator}, with the entry that broke it.
 */
public record AssignmentViolation(ViolationKind kind, AssignmentEntry entry, String detail) {

    public AssignmentViolation {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(entry, "entry");
    }

    /**
     * A dangling reference whose room and timeslot still exist, i.e. the session was removed by the
     * session store.
     */
    public boolean isMissingSession(CatalogSnapshot catalog) {
        return kind == ViolationKind.DANGLING_REFERENCE && catalog.contains(entry.slot());
    }
}
