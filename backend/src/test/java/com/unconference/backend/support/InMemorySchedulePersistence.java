package com.unconference.backend.support;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.unconference.backend.modules.schedule.application.PersistedSchedule;
import com.unconference.backend.modules.schedule.application.SchedulePersistence;
import com.unconference.backend.modules.schedule.domain.AssignmentEntry;
import com.unconference.backend.modules.schedule.domain.RoomSnapshot;
import com.unconference.backend.modules.schedule.domain.ScheduleTransition;
import com.unconference.backend.modules.schedule.domain.TimeslotSnapshot;

import org.springframework.dao.DataIntegrityViolationException;

/**
 * Table-like stand-in for the JPA adapter, including the uniqueness constraints of
 * {@code timeslot_assignment}.
 */
public class InMemorySchedulePersistence implements SchedulePersistence {

    private final Map<UUID, RoomSnapshot> rooms = new LinkedHashMap<>();
    private final Map<UUID, TimeslotSnapshot> timeslots = new LinkedHashMap<>();
    private final List<AssignmentEntry> entries = new ArrayList<>();
    private int commits;
    private boolean failNextCommit;

    public InMemorySchedulePersistence(List<RoomSnapshot> rooms, List<TimeslotSnapshot> timeslots) {
        rooms.forEach(room -> this.rooms.put(room.id(), room));
        timeslots.forEach(timeslot -> this.timeslots.put(timeslot.id(), timeslot));
    }

    @Override
    public synchronized PersistedSchedule load() {
        return new PersistedSchedule(List.copyOf(rooms.values()), List.copyOf(timeslots.values()), List.copyOf(entries));
    }

    @Override
    public synchronized void commit(ScheduleTransition transition) {
        if (failNextCommit) {
            failNextCommit = false;
            throw new DataIntegrityViolationException("duplicate key value violates unique constraint");
        }
        List<AssignmentEntry> next = new ArrayList<>(entries);
        for (AssignmentEntry removal : transition.removals()) {
            if (!next.remove(removal) && !transition.sessionsDetached().contains(removal.sessionId())) {
                throw new DataIntegrityViolationException("Assignment row for " + removal + " is missing");
            }
        }
        next.addAll(transition.insertions());
        Set<Object> slots = new HashSet<>();
        Set<UUID> sessions = new HashSet<>();
        for (AssignmentEntry entry : next) {
            if (!slots.add(entry.slot()) || !sessions.add(entry.sessionId())) {
                throw new DataIntegrityViolationException("Unique constraint violated by " + entry);
            }
        }
        transition.roomsRemoved().forEach(rooms::remove);
        transition.timeslotsRemoved().forEach(timeslots::remove);
        transition.roomsAdded().forEach(room -> rooms.put(room.id(), room));
        transition.timeslotsAdded().forEach(timeslot -> timeslots.put(timeslot.id(), timeslot));
        entries.clear();
        entries.addAll(next);
        commits++;
    }

    /**
     * Deletes the session's row the way the {@code session_id} foreign key cascade does, without
     * telling the store.
     */
    public synchronized void cascadeSessionDelete(UUID sessionId) {
        entries.removeIf(entry -> entry.sessionId().equals(sessionId));
    }

    public synchronized void failNextCommit() {
        failNextCommit = true;
    }

    public synchronized int commits() {
        return commits;
    }

    public synchronized List<AssignmentEntry> storedEntries() {
        return List.copyOf(entries);
    }

    public synchronized Set<UUID> storedRoomIds() {
        return Set.copyOf(rooms.keySet());
    }
}
