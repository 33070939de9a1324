package com.unconference.backend.modules.schedule.presentation.dto;

import java.util.UUID;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record SwapSessionsRequest(
        @NotNull(message = "slotA is required")
        @Valid
        SlotRequest slotA,
        @NotNull(message = "slotB is required")
        @Valid
        SlotRequest slotB,
        UUID sessionIdA,
        UUID sessionIdB,
        Long expectedVersion
) {
}
