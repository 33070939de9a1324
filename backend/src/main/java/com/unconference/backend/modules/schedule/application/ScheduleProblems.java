package com.unconference.backend.modules.schedule.application;

import java.util.UUID;

import com.unconference.backend.modules.schedule.domain.AssignmentViolation;
import com.unconference.backend.modules.schedule.domain.Slot;

final class ScheduleProblems {

    private ScheduleProblems() {
    }

    static ScheduleMutationException permissionDenied(String operation) {
        return new ScheduleMutationException(ScheduleErrorKind.PERMISSION_DENIED, "SCHEDULE_EDITOR_ONLY",
                "Only facilitators and admins may %s the schedule".formatted(operation));
    }

    static ScheduleMutationException slotBlocked(Slot slot, String reason) {
        return new ScheduleMutationException(ScheduleErrorKind.SLOT_BLOCKED, "SLOT_BLOCKED",
                "Slot %s is blocked: %s".formatted(slot, reason));
    }

    static ScheduleMutationException roomNotFound(UUID roomId) {
        return new ScheduleMutationException(ScheduleErrorKind.NOT_FOUND, "ROOM_NOT_FOUND",
                "Room %s not found".formatted(roomId));
    }

    static ScheduleMutationException timeslotNotFound(UUID timeslotId) {
        return new ScheduleMutationException(ScheduleErrorKind.NOT_FOUND, "TIMESLOT_NOT_FOUND",
                "Timeslot %s not found".formatted(timeslotId));
    }

    static ScheduleMutationException sessionNotFound(UUID sessionId) {
        return new ScheduleMutationException(ScheduleErrorKind.NOT_FOUND, "SESSION_NOT_FOUND",
                "Session %s not found".formatted(sessionId));
    }

    static ScheduleMutationException slotEmpty(Slot slot) {
        return new ScheduleMutationException(ScheduleErrorKind.NOT_FOUND, "SLOT_EMPTY",
                "No session is assigned to slot %s".formatted(slot));
    }

    static ScheduleMutationException invariantViolation(AssignmentViolation violation) {
        return new ScheduleMutationException(ScheduleErrorKind.INVARIANT_VIOLATION, "INVARIANT_VIOLATION",
                "%s: %s".formatted(violation.kind(), violation.detail()));
    }

    static ScheduleMutationException invariantViolation(String detail) {
        return new ScheduleMutationException(ScheduleErrorKind.INVARIANT_VIOLATION, "INVARIANT_VIOLATION", detail);
    }

    static ScheduleMutationException invalidRequest(String code, String detail) {
        return new ScheduleMutationException(ScheduleErrorKind.INVALID_REQUEST, code, detail);
    }

    static ScheduleConflictException staleSchedule(String detail) {
        return new ScheduleConflictException("STALE_SCHEDULE", detail);
    }

    static ScheduleConflictException catalogChanged() {
        return new ScheduleConflictException("CATALOG_CHANGED",
                "Rooms, timeslots or sessions changed while the schedule was being generated");
    }

    static ScheduleConflictException generationSuperseded() {
        return new ScheduleConflictException("GENERATION_SUPERSEDED",
                "A newer generate request replaced this one");
    }

    static ScheduleConflictException slotOccupied(Slot slot) {
        return new ScheduleConflictException("SLOT_OCCUPIED", "Slot %s already holds a session".formatted(slot));
    }

    static ScheduleConflictException alreadyScheduled(UUID sessionId, Slot slot) {
        return new ScheduleConflictException("SESSION_ALREADY_SCHEDULED",
                "Session %s is already scheduled in slot %s".formatted(sessionId, slot));
    }

    static ScheduleConflictException scheduleFull() {
        return new ScheduleConflictException("SCHEDULE_FULL", "No free slot is left on the schedule");
    }

    static ScheduleConflictException concurrentModification() {
        return new ScheduleConflictException("CONCURRENT_MODIFICATION",
                "The schedule was modified concurrently; reload and retry");
    }
}
