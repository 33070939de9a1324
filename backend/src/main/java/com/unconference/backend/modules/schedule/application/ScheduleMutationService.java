package com.unconference.backend.modules.schedule.application;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import com.unconference.backend.global.security.CallerRole;
import com.unconference.backend.modules.schedule.domain.AssignmentEntry;
import com.unconference.backend.modules.schedule.domain.CatalogSnapshot;
import com.unconference.backend.modules.schedule.domain.RoomSnapshot;
import com.unconference.backend.modules.schedule.domain.ScheduleState;
import com.unconference.backend.modules.schedule.domain.ScheduleTransition;
import com.unconference.backend.modules.schedule.domain.SessionSnapshot;
import com.unconference.backend.modules.schedule.domain.Slot;
import com.unconference.backend.modules.schedule.domain.TimeslotSnapshot;
import com.unconference.backend.modules.schedule.presentation.dto.CreateRoomRequest;
import com.unconference.backend.modules.schedule.presentation.dto.CreateTimeslotRequest;
import com.unconference.backend.modules.schedule.presentation.dto.RoomResponse;
import com.unconference.backend.modules.schedule.presentation.dto.ScheduleResponse;
import com.unconference.backend.modules.schedule.presentation.dto.SlotChangeResponse;
import com.unconference.backend.modules.schedule.presentation.dto.SlotResponse;
import com.unconference.backend.modules.schedule.presentation.dto.TimeslotResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Every schedule write goes through here. Each operation checks the caller role, plans a
 * {@link ScheduleTransition} against the current state and hands it to the {@link AssignmentStore},
 * which validates and commits it atomically.
 */
@Service
public class ScheduleMutationService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleMutationService.class);

    private final AssignmentStore assignmentStore;
    private final ScheduleOptimizer scheduleOptimizer;
    private final GenerationCoordinator generationCoordinator;
    private final SessionDirectory sessionDirectory;
    private final ScheduleReadService scheduleReadService;

    public ScheduleMutationService(
            AssignmentStore assignmentStore,
            ScheduleOptimizer scheduleOptimizer,
            GenerationCoordinator generationCoordinator,
            SessionDirectory sessionDirectory,
            ScheduleReadService scheduleReadService
    ) {
        this.assignmentStore = assignmentStore;
        this.scheduleOptimizer = scheduleOptimizer;
        this.generationCoordinator = generationCoordinator;
        this.sessionDirectory = sessionDirectory;
        this.scheduleReadService = scheduleReadService;
    }

    /**
     * Recomputes the whole schedule. The optimizer runs on a snapshot without holding the writer lock;
     * the result is committed only if no newer generate request arrived and the catalog and session
     * population are unchanged.
     */
    public ScheduleResponse generate(CallerRole role) {
        ensureEditor(role, "generate");
        GenerationCoordinator.Ticket ticket = generationCoordinator.issue();
        ScheduleState basis = assignmentStore.snapshot();
        List<SessionSnapshot> sessions = sessionDirectory.findAll();
        Set<UUID> basisSessionIds = sessions.stream().map(SessionSnapshot::id).collect(Collectors.toSet());

        OptimizationResult result;
        try {
            result = scheduleOptimizer.optimize(basis.catalog(), sessions, ticket::isSuperseded);
        } catch (GenerationCancelledException ex) {
            log.info("Schedule generation {} cancelled by a newer request", ticket);
            throw ScheduleProblems.generationSuperseded();
        }

        ScheduleCommit commit = assignmentStore.mutate("generate", current -> {
            if (ticket.isSuperseded()) {
                throw ScheduleProblems.generationSuperseded();
            }
            if (current.catalogVersion() != basis.catalogVersion()
                    || !sessionDirectory.findAllIds().equals(basisSessionIds)) {
                throw ScheduleProblems.catalogChanged();
            }
            return ScheduleTransition.ofEntries(current.assignment().entries(), result.entries());
        });
        return scheduleReadService.toResponse(commit.state());
    }

    public ScheduleResponse clear(CallerRole role) {
        ensureEditor(role, "clear");
        ScheduleCommit commit = assignmentStore.mutate("clear",
                current -> ScheduleTransition.ofEntries(current.assignment().entries(), List.of()));
        return scheduleReadService.toResponse(commit.state());
    }

    /**
     * Moves the session in {@code from} to {@code to}; an occupied target turns the move into a swap.
     */
    public SlotChangeResponse move(CallerRole role, Slot from, Slot to, UUID expectedSessionId, Long expectedVersion) {
        ensureEditor(role, "edit");
        ScheduleCommit commit = assignmentStore.mutate("move", current -> {
            CatalogSnapshot catalog = current.catalog();
            requireSlot(catalog, from);
            requireSlot(catalog, to);
            checkVersion(current, expectedVersion);
            UUID moving = current.assignment().sessionAt(from)
                    .orElseThrow(() -> ScheduleProblems.slotEmpty(from));
            checkExpectedSession(from, moving, expectedSessionId);
            if (from.equals(to)) {
                return ScheduleTransition.none();
            }
            requireNotBlocked(catalog, to);

            AssignmentEntry leaving = new AssignmentEntry(from, moving);
            Optional<UUID> displaced = current.assignment().sessionAt(to);
            if (displaced.isEmpty()) {
                return ScheduleTransition.ofEntries(List.of(leaving), List.of(new AssignmentEntry(to, moving)));
            }
            return ScheduleTransition.ofEntries(
                    List.of(leaving, new AssignmentEntry(to, displaced.get())),
                    List.of(new AssignmentEntry(to, moving), new AssignmentEntry(from, displaced.get()))
            );
        });
        return touched(commit, List.of(from, to));
    }

    public SlotChangeResponse swap(
            CallerRole role,
            Slot slotA,
            Slot slotB,
            UUID expectedSessionA,
            UUID expectedSessionB,
            Long expectedVersion
    ) {
        ensureEditor(role, "edit");
        ScheduleCommit commit = assignmentStore.mutate("swap", current -> {
            CatalogSnapshot catalog = current.catalog();
            requireSlot(catalog, slotA);
            requireSlot(catalog, slotB);
            checkVersion(current, expectedVersion);
            requireNotBlocked(catalog, slotA);
            requireNotBlocked(catalog, slotB);
            UUID sessionA = current.assignment().sessionAt(slotA)
                    .orElseThrow(() -> ScheduleProblems.slotEmpty(slotA));
            UUID sessionB = current.assignment().sessionAt(slotB)
                    .orElseThrow(() -> ScheduleProblems.slotEmpty(slotB));
            checkExpectedSession(slotA, sessionA, expectedSessionA);
            checkExpectedSession(slotB, sessionB, expectedSessionB);
            if (slotA.equals(slotB)) {
                return ScheduleTransition.none();
            }
            return ScheduleTransition.ofEntries(
                    List.of(new AssignmentEntry(slotA, sessionA), new AssignmentEntry(slotB, sessionB)),
                    List.of(new AssignmentEntry(slotA, sessionB), new AssignmentEntry(slotB, sessionA))
            );
        });
        return touched(commit, List.of(slotA, slotB));
    }

    /**
     * Places an unscheduled session. A null {@code target} picks the first free eligible slot in slot order.
     */
    public SlotChangeResponse assignSession(CallerRole role, UUID sessionId, Slot target) {
        ensureEditor(role, "edit");
        ScheduleCommit commit = assignmentStore.mutate("assignSession", current -> {
            if (sessionDirectory.findExistingIds(Set.of(sessionId)).isEmpty()) {
                throw ScheduleProblems.sessionNotFound(sessionId);
            }
            Optional<Slot> existing = current.assignment().slotOf(sessionId);
            if (existing.isPresent()) {
                throw ScheduleProblems.alreadyScheduled(sessionId, existing.get());
            }
            Slot slot = target == null ? firstFreeSlot(current) : checkedTarget(current, target);
            return ScheduleTransition.ofEntries(List.of(), List.of(new AssignmentEntry(slot, sessionId)));
        });
        List<Slot> slots = commit.transition().insertions().stream().map(AssignmentEntry::slot).toList();
        return touched(commit, slots);
    }

    public SlotChangeResponse unassignSession(CallerRole role, Slot slot, UUID expectedSessionId) {
        ensureEditor(role, "edit");
        ScheduleCommit commit = assignmentStore.mutate("unassignSession", current -> {
            requireSlot(current.catalog(), slot);
            UUID sessionId = current.assignment().sessionAt(slot)
                    .orElseThrow(() -> ScheduleProblems.slotEmpty(slot));
            checkExpectedSession(slot, sessionId, expectedSessionId);
            return ScheduleTransition.ofEntries(List.of(new AssignmentEntry(slot, sessionId)), List.of());
        });
        return touched(commit, List.of(slot));
    }

    /**
     * Cascade hook for the session store: drops the session's entry, if any, and invalidates running
     * generations.
     */
    public void detachSession(CallerRole role, UUID sessionId) {
        ensureEditor(role, "edit");
        assignmentStore.mutate("detachSession", current -> {
            List<AssignmentEntry> cascaded = current.assignment().slotOf(sessionId)
                    .map(slot -> List.of(new AssignmentEntry(slot, sessionId)))
                    .orElse(List.of());
            return ScheduleTransition.detachSession(sessionId, cascaded);
        });
    }

    public RoomResponse addRoom(CallerRole role, CreateRoomRequest request) {
        ensureEditor(role, "edit");
        RoomSnapshot room = new RoomSnapshot(UUID.randomUUID(), request.name().trim(), request.location(), request.availableSpots());
        assignmentStore.mutate("addRoom", current -> ScheduleTransition.addRoom(room));
        return RoomResponse.from(room);
    }

    public void removeRoom(CallerRole role, UUID roomId) {
        ensureEditor(role, "edit");
        assignmentStore.mutate("removeRoom", current -> {
            if (!current.catalog().containsRoom(roomId)) {
                throw ScheduleProblems.roomNotFound(roomId);
            }
            List<AssignmentEntry> cascaded = current.assignment().entries().stream()
                    .filter(entry -> entry.slot().roomId().equals(roomId))
                    .toList();
            return ScheduleTransition.removeRoom(roomId, cascaded);
        });
    }

    public TimeslotResponse addTimeslot(CallerRole role, CreateTimeslotRequest request) {
        ensureEditor(role, "edit");
        if (!request.endsAt().isAfter(request.startsAt())) {
            throw ScheduleProblems.invalidRequest("INVALID_TIME_RANGE", "endsAt must be after startsAt");
        }
        String blockedReason = request.blockedReason();
        if (request.blocked() != null && (blockedReason == null || blockedReason.isBlank())) {
            throw ScheduleProblems.invalidRequest("BLOCKED_REASON_REQUIRED", "A blocked timeslot needs a reason");
        }
        TimeslotSnapshot timeslot = new TimeslotSnapshot(
                UUID.randomUUID(),
                request.startsAt(),
                request.endsAt(),
                blockedReason == null ? null : blockedReason.trim()
        );
        assignmentStore.mutate("addTimeslot", current -> ScheduleTransition.addTimeslot(timeslot));
        return TimeslotResponse.from(timeslot);
    }

    public void removeTimeslot(CallerRole role, UUID timeslotId) {
        ensureEditor(role, "edit");
        assignmentStore.mutate("removeTimeslot", current -> {
            if (!current.catalog().containsTimeslot(timeslotId)) {
                throw ScheduleProblems.timeslotNotFound(timeslotId);
            }
            List<AssignmentEntry> cascaded = current.assignment().entries().stream()
                    .filter(entry -> entry.slot().timeslotId().equals(timeslotId))
                    .toList();
            return ScheduleTransition.removeTimeslot(timeslotId, cascaded);
        });
    }

    private void ensureEditor(CallerRole role, String operation) {
        if (role == null || !role.canEditSchedule()) {
            log.info("Schedule {} denied for role {}", operation, role);
            throw ScheduleProblems.permissionDenied(operation);
        }
    }

    private static void requireSlot(CatalogSnapshot catalog, Slot slot) {
        if (!catalog.containsRoom(slot.roomId())) {
            throw ScheduleProblems.roomNotFound(slot.roomId());
        }
        if (!catalog.containsTimeslot(slot.timeslotId())) {
            throw ScheduleProblems.timeslotNotFound(slot.timeslotId());
        }
    }

    private static void requireNotBlocked(CatalogSnapshot catalog, Slot slot) {
        catalog.timeslot(slot.timeslotId())
                .filter(TimeslotSnapshot::isBlocked)
                .ifPresent(timeslot -> {
                    throw ScheduleProblems.slotBlocked(slot, timeslot.blockedReason());
                });
    }

    private static void checkVersion(ScheduleState current, Long expectedVersion) {
        if (expectedVersion != null && expectedVersion != current.version()) {
            throw ScheduleProblems.staleSchedule(
                    "Expected schedule version %d but it is %d".formatted(expectedVersion, current.version()));
        }
    }

    private static void checkExpectedSession(Slot slot, UUID actual, UUID expected) {
        if (expected != null && !expected.equals(actual)) {
            throw ScheduleProblems.staleSchedule(
                    "Slot %s holds session %s, not %s".formatted(slot, actual, expected));
        }
    }

    private static Slot checkedTarget(ScheduleState current, Slot target) {
        requireSlot(current.catalog(), target);
        requireNotBlocked(current.catalog(), target);
        if (current.assignment().isOccupied(target)) {
            throw ScheduleProblems.slotOccupied(target);
        }
        return target;
    }

    private static Slot firstFreeSlot(ScheduleState current) {
        return current.catalog().eligibleSlots().stream()
                .filter(slot -> !current.assignment().isOccupied(slot))
                .findFirst()
                .orElseThrow(ScheduleProblems::scheduleFull);
    }

    private static SlotChangeResponse touched(ScheduleCommit commit, List<Slot> slots) {
        return new SlotChangeResponse(
                commit.state().version(),
                slots.stream()
                        .distinct()
                        .map(slot -> SlotResponse.from(slot, commit.state().assignment().sessionAt(slot).orElse(null)))
                        .toList()
        );
    }
}
