package com.unconference.backend.modules.schedule.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * A (room, timeslot) pair, the atomic unit of scheduling.
 */
public record Slot(UUID roomId, UUID timeslotId) {

    public Slot {
        Objects.requireNonNull(roomId, "roomId");
        Objects.requireNonNull(timeslotId, "timeslotId");
    }

    @Override
    public String toString() {
        return "(" + roomId + ", " + timeslotId + ")";
    }
}
