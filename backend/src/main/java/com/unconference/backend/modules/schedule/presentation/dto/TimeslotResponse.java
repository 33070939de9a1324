package com.unconference.backend.modules.schedule.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.unconference.backend.modules.schedule.domain.TimeslotSnapshot;

public record TimeslotResponse(
        UUID id,
        OffsetDateTime startsAt,
        OffsetDateTime endsAt,
        long durationMinutes,
        boolean blocked,
        String blockedReason
) {

    public static TimeslotResponse from(TimeslotSnapshot timeslot) {
        return new TimeslotResponse(
                timeslot.id(),
                timeslot.startsAt(),
                timeslot.endsAt(),
                timeslot.duration().toMinutes(),
                timeslot.isBlocked(),
                timeslot.blockedReason()
        );
    }
}
