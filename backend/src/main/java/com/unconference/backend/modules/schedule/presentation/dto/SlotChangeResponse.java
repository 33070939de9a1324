package com.unconference.backend.modules.schedule.presentation.dto;

import java.util.List;

public record SlotChangeResponse(long version, List<SlotResponse> touched) {
}
