package com.unconference.backend.modules.schedule.presentation.dto;

import java.time.OffsetDateTime;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateTimeslotRequest(
        @NotNull(message = "startsAt is required")
        OffsetDateTime startsAt,
        @NotNull(message = "endsAt is required")
        OffsetDateTime endsAt,
        @Valid
        Blocked blocked
) {

    public String blockedReason() {
        return blocked == null ? null : blocked.reason();
    }

    public record Blocked(
            @Size(max = 255, message = "reason must be at most 255 characters")
            String reason
    ) {
    }
}
