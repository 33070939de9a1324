package com.unconference.backend.modules.schedule.domain;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * One atomic change to the schedule state: entries to drop, entries to add and catalog edits, applied
 * together or not at all. A swap is two removals plus two insertions in the same transition.
 */
public record ScheduleTransition(
        List<AssignmentEntry> removals,
        List<AssignmentEntry> insertions,
        List<RoomSnapshot> roomsAdded,
        Set<UUID> roomsRemoved,
        List<TimeslotSnapshot> timeslotsAdded,
        Set<UUID> timeslotsRemoved,
        Set<UUID> sessionsDetached
) {

    public ScheduleTransition {
        removals = List.copyOf(Objects.requireNonNull(removals, "removals"));
        insertions = List.copyOf(Objects.requireNonNull(insertions, "insertions"));
        roomsAdded = List.copyOf(Objects.requireNonNull(roomsAdded, "roomsAdded"));
        roomsRemoved = Set.copyOf(Objects.requireNonNull(roomsRemoved, "roomsRemoved"));
        timeslotsAdded = List.copyOf(Objects.requireNonNull(timeslotsAdded, "timeslotsAdded"));
        timeslotsRemoved = Set.copyOf(Objects.requireNonNull(timeslotsRemoved, "timeslotsRemoved"));
        sessionsDetached = Set.copyOf(Objects.requireNonNull(sessionsDetached, "sessionsDetached"));
    }

    public static ScheduleTransition ofEntries(List<AssignmentEntry> removals, List<AssignmentEntry> insertions) {
        return new ScheduleTransition(removals, insertions, List.of(), Set.of(), List.of(), Set.of(), Set.of());
    }

    public static ScheduleTransition none() {
        return ofEntries(List.of(), List.of());
    }

    public static ScheduleTransition addRoom(RoomSnapshot room) {
        return new ScheduleTransition(List.of(), List.of(), List.of(room), Set.of(), List.of(), Set.of(), Set.of());
    }

    public static ScheduleTransition removeRoom(UUID roomId, List<AssignmentEntry> cascaded) {
        return new ScheduleTransition(cascaded, List.of(), List.of(), Set.of(roomId), List.of(), Set.of(), Set.of());
    }

    public static ScheduleTransition addTimeslot(TimeslotSnapshot timeslot) {
        return new ScheduleTransition(List.of(), List.of(), List.of(), Set.of(), List.of(timeslot), Set.of(), Set.of());
    }

    public static ScheduleTransition removeTimeslot(UUID timeslotId, List<AssignmentEntry> cascaded) {
        return new ScheduleTransition(cascaded, List.of(), List.of(), Set.of(), List.of(), Set.of(timeslotId), Set.of());
    }

    public static ScheduleTransition detachSession(UUID sessionId, List<AssignmentEntry> cascaded) {
        return new ScheduleTransition(cascaded, List.of(), List.of(), Set.of(), List.of(), Set.of(), Set.of(sessionId));
    }

    /**
     * True when rooms, timeslots or the session population changed; generation results computed
     * against the previous catalog are stale from then on.
     */
    public boolean changesCatalog() {
        return !roomsAdded.isEmpty() || !roomsRemoved.isEmpty()
                || !timeslotsAdded.isEmpty() || !timeslotsRemoved.isEmpty()
                || !sessionsDetached.isEmpty();
    }

    public boolean isEmpty() {
        return removals.isEmpty() && insertions.isEmpty() && !changesCatalog();
    }

    public CatalogSnapshot applyTo(CatalogSnapshot catalog) {
        CatalogSnapshot next = catalog.withoutRooms(roomsRemoved).withoutTimeslots(timeslotsRemoved);
        for (RoomSnapshot room : roomsAdded) {
            next = next.withRoom(room);
        }
        for (TimeslotSnapshot timeslot : timeslotsAdded) {
            next = next.withTimeslot(timeslot);
        }
        return next;
    }
}
