package com.unconference.backend.modules.schedule.domain;

import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Checks the four assignment invariants:
 * <ol>
 *     <li>a slot holds at most one session</li>
 *     <li>a session occupies at most one slot</li>
 *     <li>no entry sits in a blocked timeslot</li>
 *     <li>every referenced room, timeslot and session exists</li>
 * </ol>
 * Pure and side-effect free; entries are checked in iteration order and the first violation wins.
 */
public final class AssignmentValidator {

    private AssignmentValidator() {
    }

    public static Optional<AssignmentViolation> validate(
            Collection<AssignmentEntry> entries,
            Collection<RoomSnapshot> rooms,
            Collection<TimeslotSnapshot> timeslots,
            Set<UUID> sessionIds
    ) {
        Set<UUID> roomIds = rooms.stream().map(RoomSnapshot::id).collect(Collectors.toSet());
        Map<UUID, TimeslotSnapshot> timeslotsById = timeslots.stream()
                .collect(Collectors.toMap(TimeslotSnapshot::id, Function.identity(), (left, right) -> left));

        Set<Slot> seenSlots = new HashSet<>();
        Set<UUID> seenSessions = new HashSet<>();
        for (AssignmentEntry entry : entries) {
            Slot slot = entry.slot();
            if (!seenSlots.add(slot)) {
                return violation(ViolationKind.DUPLICATE_SLOT, entry, "Slot %s holds more than one session".formatted(slot));
            }
            if (!seenSessions.add(entry.sessionId())) {
                return violation(ViolationKind.DUPLICATE_SESSION, entry,
                        "Session %s is assigned to more than one slot".formatted(entry.sessionId()));
            }
            if (!roomIds.contains(slot.roomId())) {
                return violation(ViolationKind.DANGLING_REFERENCE, entry, "Room %s does not exist".formatted(slot.roomId()));
            }
            TimeslotSnapshot timeslot = timeslotsById.get(slot.timeslotId());
            if (timeslot == null) {
                return violation(ViolationKind.DANGLING_REFERENCE, entry, "Timeslot %s does not exist".formatted(slot.timeslotId()));
            }
            if (timeslot.isBlocked()) {
                return violation(ViolationKind.BLOCKED_SLOT, entry,
                        "Timeslot %s is blocked: %s".formatted(slot.timeslotId(), timeslot.blockedReason()));
            }
            if (!sessionIds.contains(entry.sessionId())) {
                return violation(ViolationKind.DANGLING_REFERENCE, entry, "Session %s does not exist".formatted(entry.sessionId()));
            }
        }
        return Optional.empty();
    }

    public static Optional<AssignmentViolation> validate(Assignment assignment, CatalogSnapshot catalog, Set<UUID> sessionIds) {
        return validate(assignment.entries(), catalog.rooms(), catalog.timeslots(), sessionIds);
    }

    private static Optional<AssignmentViolation> violation(ViolationKind kind, AssignmentEntry entry, String detail) {
        return Optional.of(new AssignmentViolation(kind, entry, detail));
    }
}
