package com.unconference.backend.modules.schedule.application;

import java.util.List;

import com.unconference.backend.modules.schedule.domain.AssignmentEntry;
import com.unconference.backend.modules.schedule.domain.RoomSnapshot;
import com.unconference.backend.modules.schedule.domain.TimeslotSnapshot;

public record PersistedSchedule(List<RoomSnapshot> rooms, List<TimeslotSnapshot> timeslots, List<AssignmentEntry> entries) {

    public PersistedSchedule {
        rooms = List.copyOf(rooms);
        timeslots = List.copyOf(timeslots);
        entries = List.copyOf(entries);
    }
}
