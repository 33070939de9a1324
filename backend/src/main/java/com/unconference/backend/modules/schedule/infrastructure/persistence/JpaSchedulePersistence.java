package com.unconference.backend.modules.schedule.infrastructure.persistence;

import java.util.List;

import com.unconference.backend.modules.catalog.domain.Room;
import com.unconference.backend.modules.catalog.domain.Timeslot;
import com.unconference.backend.modules.catalog.infrastructure.persistence.RoomRepository;
import com.unconference.backend.modules.catalog.infrastructure.persistence.TimeslotRepository;
import com.unconference.backend.modules.schedule.application.PersistedSchedule;
import com.unconference.backend.modules.schedule.application.SchedulePersistence;
import com.unconference.backend.modules.schedule.domain.AssignmentEntry;
import com.unconference.backend.modules.schedule.domain.RoomSnapshot;
import com.unconference.backend.modules.schedule.domain.ScheduleTransition;
import com.unconference.backend.modules.schedule.domain.TimeslotAssignment;
import com.unconference.backend.modules.schedule.domain.TimeslotSnapshot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class JpaSchedulePersistence implements SchedulePersistence {

    private static final Logger log = LoggerFactory.getLogger(JpaSchedulePersistence.class);

    private final RoomRepository roomRepository;
    private final TimeslotRepository timeslotRepository;
    private final TimeslotAssignmentRepository timeslotAssignmentRepository;

    public JpaSchedulePersistence(
            RoomRepository roomRepository,
            TimeslotRepository timeslotRepository,
            TimeslotAssignmentRepository timeslotAssignmentRepository
    ) {
        this.roomRepository = roomRepository;
        this.timeslotRepository = timeslotRepository;
        this.timeslotAssignmentRepository = timeslotAssignmentRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public PersistedSchedule load() {
        List<RoomSnapshot> rooms = roomRepository.findAllByOrderByIdAsc().stream()
                .map(room -> new RoomSnapshot(room.getId(), room.getName(), room.getLocation(), room.getAvailableSpots()))
                .toList();
        List<TimeslotSnapshot> timeslots = timeslotRepository.findAllByOrderByStartsAtAscIdAsc().stream()
                .map(timeslot -> new TimeslotSnapshot(
                        timeslot.getId(), timeslot.getStartsAt(), timeslot.getEndsAt(), timeslot.getBlockedReason()))
                .toList();
        List<AssignmentEntry> entries = timeslotAssignmentRepository.findAll().stream()
                .map(TimeslotAssignment::toEntry)
                .toList();
        return new PersistedSchedule(rooms, timeslots, entries);
    }

    /**
     * Bulk deletes run immediately, so every removal is gone before the first insert is flushed.
     * A removal must hit exactly one row, except for a detached session whose row the
     * {@code session_id} cascade may already have deleted.
     */
    @Override
    @Transactional
    public void commit(ScheduleTransition transition) {
        for (AssignmentEntry removal : transition.removals()) {
            int deleted = timeslotAssignmentRepository.deleteEntry(
                    removal.slot().roomId(), removal.slot().timeslotId(), removal.sessionId());
            if (deleted != 1 && !(deleted == 0 && transition.sessionsDetached().contains(removal.sessionId()))) {
                throw new DataIntegrityViolationException("Assignment row for " + removal + " is missing");
            }
        }
        if (!transition.roomsRemoved().isEmpty()) {
            roomRepository.deleteAllByIdInBatch(transition.roomsRemoved());
        }
        if (!transition.timeslotsRemoved().isEmpty()) {
            timeslotRepository.deleteAllByIdInBatch(transition.timeslotsRemoved());
        }
        for (RoomSnapshot room : transition.roomsAdded()) {
            roomRepository.save(new Room(room.id(), room.name(), room.location(), room.availableSpots()));
        }
        for (TimeslotSnapshot timeslot : transition.timeslotsAdded()) {
            timeslotRepository.save(new Timeslot(timeslot.id(), timeslot.startsAt(), timeslot.endsAt(), timeslot.blockedReason()));
        }
        if (!transition.insertions().isEmpty()) {
            timeslotAssignmentRepository.saveAll(transition.insertions().stream().map(TimeslotAssignment::from).toList());
        }
        timeslotAssignmentRepository.flush();
        log.debug("Persisted schedule transition: removals={}, insertions={}, roomsAdded={}, roomsRemoved={}, "
                        + "timeslotsAdded={}, timeslotsRemoved={}",
                transition.removals().size(), transition.insertions().size(),
                transition.roomsAdded().size(), transition.roomsRemoved().size(),
                transition.timeslotsAdded().size(), transition.timeslotsRemoved().size());
    }
}
