package com.unconference.backend.modules.schedule.presentation.dto;

import java.util.List;
import java.util.UUID;

public record ScheduleResponse(
        long version,
        List<RoomResponse> rooms,
        List<TimeslotResponse> timeslots,
        List<ScheduleEntryResponse> entries,
        List<SessionSummary> unassignedSessions
) {

    public record ScheduleEntryResponse(
            UUID roomId,
            UUID timeslotId,
            UUID sessionId,
            String title,
            Integer voteCount
    ) {
    }

    public record SessionSummary(UUID sessionId, String title, int voteCount, String tag) {
    }
}
