package com.unconference.backend.modules.schedule.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Partial injective mapping from slots to session ids. Instances are immutable; every edit produces a
 * new value through {@link #apply(ScheduleTransition)} followed by {@link #of(Collection)}.
 */
public final class Assignment {

    private static final Assignment EMPTY = new Assignment(Map.of(), Map.of());

    private final Map<Slot, UUID> sessionsBySlot;
    private final Map<UUID, Slot> slotsBySession;

    private Assignment(Map<Slot, UUID> sessionsBySlot, Map<UUID, Slot> slotsBySession) {
        this.sessionsBySlot = sessionsBySlot;
        this.slotsBySession = slotsBySession;
    }

    /**
     * @throws IllegalArgumentException if a slot or a session occurs twice
     */
    public static Assignment of(Collection<AssignmentEntry> entries) {
        if (entries.isEmpty()) {
            return EMPTY;
        }
        Map<Slot, UUID> bySlot = new LinkedHashMap<>();
        Map<UUID, Slot> bySession = new HashMap<>();
        for (AssignmentEntry entry : entries) {
            if (bySlot.putIfAbsent(entry.slot(), entry.sessionId()) != null) {
                throw new IllegalArgumentException("Slot " + entry.slot() + " assigned twice");
            }
            if (bySession.putIfAbsent(entry.sessionId(), entry.slot()) != null) {
                throw new IllegalArgumentException("Session " + entry.sessionId() + " assigned twice");
            }
        }
        return new Assignment(Collections.unmodifiableMap(bySlot), Collections.unmodifiableMap(bySession));
    }

    public Optional<UUID> sessionAt(Slot slot) {
        return Optional.ofNullable(sessionsBySlot.get(slot));
    }

    public Optional<Slot> slotOf(UUID sessionId) {
        return Optional.ofNullable(slotsBySession.get(sessionId));
    }

    public boolean isOccupied(Slot slot) {
        return sessionsBySlot.containsKey(slot);
    }

    public int size() {
        return sessionsBySlot.size();
    }

    public boolean isEmpty() {
        return sessionsBySlot.isEmpty();
    }

    public List<AssignmentEntry> entries() {
        List<AssignmentEntry> entries = new ArrayList<>(sessionsBySlot.size());
        sessionsBySlot.forEach((slot, sessionId) -> entries.add(new AssignmentEntry(slot, sessionId)));
        return entries;
    }

    /**
     * Raw entry list after the transition's removals and insertions. The result is not checked for
     * duplicates so the validator can report them.
     *
     * @throws IllegalStateException if a removal does not match the current mapping
     */
    public List<AssignmentEntry> apply(ScheduleTransition transition) {
        Map<Slot, UUID> remaining = new LinkedHashMap<>(sessionsBySlot);
        for (AssignmentEntry removal : transition.removals()) {
            UUID current = remaining.get(removal.slot());
            if (current == null || !current.equals(removal.sessionId())) {
                throw new IllegalStateException("Removal " + removal + " does not match the current assignment");
            }
            remaining.remove(removal.slot());
        }
        List<AssignmentEntry> result = new ArrayList<>(remaining.size() + transition.insertions().size());
        remaining.forEach((slot, sessionId) -> result.add(new AssignmentEntry(slot, sessionId)));
        result.addAll(transition.insertions());
        return result;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof Assignment that && sessionsBySlot.equals(that.sessionsBySlot);
    }

    @Override
    public int hashCode() {
        return sessionsBySlot.hashCode();
    }

    @Override
    public String toString() {
        return "Assignment" + sessionsBySlot;
    }
}
