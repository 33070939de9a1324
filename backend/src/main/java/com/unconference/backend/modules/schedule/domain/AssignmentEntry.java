package com.unconference.backend.modules.schedule.domain;

import java.util.Objects;
import java.util.UUID;

public record AssignmentEntry(Slot slot, UUID sessionId) {

    public AssignmentEntry {
        Objects.requireNonNull(slot, "slot");
        Objects.requireNonNull(sessionId, "sessionId");
    }

    public static AssignmentEntry of(UUID roomId, UUID timeslotId, UUID sessionId) {
        return new AssignmentEntry(new Slot(roomId, timeslotId), sessionId);
    }
}
