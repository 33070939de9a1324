package com.unconference.backend.modules.schedule.presentation.dto;

import java.util.UUID;

import com.unconference.backend.modules.schedule.domain.Slot;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * {@code sessionId} and {@code expectedVersion} are optional staleness guards: when present they must
 * match the session currently in {@code fromSlot} and the current schedule version.
 */
public record MoveSessionRequest(
        @NotNull(message = "fromSlot is required")
        @Valid
        SlotRequest fromSlot,
        @NotNull(message = "toRoomId is required")
        UUID toRoomId,
        @NotNull(message = "toTimeslotId is required")
        UUID toTimeslotId,
        UUID sessionId,
        Long expectedVersion
) {

    public Slot targetSlot() {
        return new Slot(toRoomId, toTimeslotId);
    }
}
