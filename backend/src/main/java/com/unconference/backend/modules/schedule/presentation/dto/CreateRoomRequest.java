package com.unconference.backend.modules.schedule.presentation.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateRoomRequest(
        @NotBlank(message = "name is required")
        @Size(max = 120, message = "name must be at most 120 characters")
        String name,
        @Size(max = 255, message = "location must be at most 255 characters")
        String location,
        @Min(value = 0, message = "availableSpots must not be negative")
        int availableSpots
) {
}
