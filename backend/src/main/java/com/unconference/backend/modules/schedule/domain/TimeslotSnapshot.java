package com.unconference.backend.modules.schedule.domain;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

public record TimeslotSnapshot(UUID id, OffsetDateTime startsAt, OffsetDateTime endsAt, String blockedReason) {

    public TimeslotSnapshot {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(startsAt, "startsAt");
        Objects.requireNonNull(endsAt, "endsAt");
        if (!endsAt.isAfter(startsAt)) {
            throw new IllegalArgumentException("endsAt must be after startsAt");
        }
        if (blockedReason != null && blockedReason.isBlank()) {
            throw new IllegalArgumentException("blockedReason must not be blank");
        }
    }

    public boolean isBlocked() {
        return blockedReason != null;
    }

    public Duration duration() {
        return Duration.between(startsAt, endsAt);
    }
}
