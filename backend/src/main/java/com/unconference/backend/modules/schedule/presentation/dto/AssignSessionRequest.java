package com.unconference.backend.modules.schedule.presentation.dto;

import java.util.UUID;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * Without a {@code slot} the session goes into the first free eligible slot.
 */
public record AssignSessionRequest(
        @NotNull(message = "sessionId is required")
        UUID sessionId,
        @Valid
        SlotRequest slot
) {
}
