package com.unconference.backend.modules.schedule.presentation.dto;

import java.util.UUID;

import com.unconference.backend.modules.schedule.domain.Slot;

import jakarta.validation.constraints.NotNull;

public record SlotRequest(
        @NotNull(message = "roomId is required")
        UUID roomId,
        @NotNull(message = "timeslotId is required")
        UUID timeslotId
) {

    public Slot toSlot() {
        return new Slot(roomId, timeslotId);
    }
}
