package com.unconference.backend.modules.schedule.application;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.unconference.backend.modules.schedule.domain.AssignmentEntry;
import com.unconference.backend.modules.schedule.domain.ScheduleState;
import com.unconference.backend.modules.schedule.domain.SessionSnapshot;
import com.unconference.backend.modules.schedule.presentation.dto.RoomResponse;
import com.unconference.backend.modules.schedule.presentation.dto.ScheduleResponse;
import com.unconference.backend.modules.schedule.presentation.dto.ScheduleResponse.ScheduleEntryResponse;
import com.unconference.backend.modules.schedule.presentation.dto.ScheduleResponse.SessionSummary;
import com.unconference.backend.modules.schedule.presentation.dto.TimeslotResponse;

import org.springframework.stereotype.Service;

/**
 * Lock-free views of the published schedule state. Any authenticated role may read.
 */
@Service
public class ScheduleReadService {

    private final AssignmentStore assignmentStore;
    private final SessionDirectory sessionDirectory;

    public ScheduleReadService(AssignmentStore assignmentStore, SessionDirectory sessionDirectory) {
        this.assignmentStore = assignmentStore;
        this.sessionDirectory = sessionDirectory;
    }

    public ScheduleResponse currentSchedule() {
        return toResponse(assignmentStore.snapshot());
    }

    public List<RoomResponse> listRooms() {
        return assignmentStore.snapshot().catalog().rooms().stream()
                .map(RoomResponse::from)
                .toList();
    }

    public List<TimeslotResponse> listTimeslots() {
        return assignmentStore.snapshot().catalog().timeslots().stream()
                .map(TimeslotResponse::from)
                .toList();
    }

    ScheduleResponse toResponse(ScheduleState state) {
        Map<UUID, SessionSnapshot> sessions = sessionDirectory.findAll().stream()
                .collect(Collectors.toMap(SessionSnapshot::id, Function.identity(), (left, right) -> left));

        List<ScheduleEntryResponse> entries = state.orderedEntries().stream()
                .map(entry -> toEntry(entry, sessions.get(entry.sessionId())))
                .toList();

        Set<UUID> assigned = state.assignedSessionIds();
        List<SessionSummary> unassigned = sessions.values().stream()
                .filter(session -> !assigned.contains(session.id()))
                .sorted(SessionSnapshot.BY_INTEREST)
                .map(session -> new SessionSummary(session.id(), session.title(), session.voteCount(), session.tag()))
                .toList();

        return new ScheduleResponse(
                state.version(),
                state.catalog().rooms().stream().map(RoomResponse::from).toList(),
                state.catalog().timeslots().stream().map(TimeslotResponse::from).toList(),
                entries,
                unassigned
        );
    }

    /**
     * A session deleted without the cascade hook still shows up with its id; title and votes are then null.
     */
    private static ScheduleEntryResponse toEntry(AssignmentEntry entry, SessionSnapshot session) {
        return new ScheduleEntryResponse(
                entry.slot().roomId(),
                entry.slot().timeslotId(),
                entry.sessionId(),
                session == null ? null : session.title(),
                session == null ? null : session.voteCount()
        );
    }
}
