package com.unconference.backend.modules.schedule.presentation.dto;

import java.util.UUID;

import com.unconference.backend.modules.schedule.domain.RoomSnapshot;

public record RoomResponse(UUID id, String name, String location, int availableSpots) {

    public static RoomResponse from(RoomSnapshot room) {
        return new RoomResponse(room.id(), room.name(), room.location(), room.availableSpots());
    }
}
