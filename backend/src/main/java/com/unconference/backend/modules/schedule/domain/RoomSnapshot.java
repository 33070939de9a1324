package com.unconference.backend.modules.schedule.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * {@code availableSpots} is informational; it does not restrict which sessions may use the room.
 */
public record RoomSnapshot(UUID id, String name, String location, int availableSpots) {

    public RoomSnapshot {
        Objects.requireNonNull(id, "id");
        if (availableSpots < 0) {
            throw new IllegalArgumentException("availableSpots must be >= 0");
        }
    }
}
