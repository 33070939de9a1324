package com.unconference.backend.modules.schedule.presentation.dto;

import java.util.UUID;

import com.unconference.backend.modules.schedule.domain.Slot;

/**
 * A slot touched by an edit and the session it holds afterwards; {@code sessionId} is null when the
 * edit left the slot empty.
 */
public record SlotResponse(UUID roomId, UUID timeslotId, UUID sessionId) {

    public static SlotResponse from(Slot slot, UUID sessionId) {
        return new SlotResponse(slot.roomId(), slot.timeslotId(), sessionId);
    }
}
