package com.unconference.backend.modules.schedule.domain;

import java.util.Comparator;
import java.util.Objects;
import java.util.UUID;

/**
 * Read-only view of a session as the session store published it at snapshot time.
 */
public record SessionSnapshot(UUID id, String title, int voteCount, String tag, UUID ownerId) {

    /** Most votes first, ties broken by ascending id. */
    public static final Comparator<SessionSnapshot> BY_INTEREST = Comparator
            .comparingInt(SessionSnapshot::voteCount).reversed()
            .thenComparing(SessionSnapshot::id, IdOrder.ASCENDING);

    public SessionSnapshot {
        Objects.requireNonNull(id, "id");
        if (voteCount < 0) {
            throw new IllegalArgumentException("voteCount must be >= 0");
        }
    }
}
