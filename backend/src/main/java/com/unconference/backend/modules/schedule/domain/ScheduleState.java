package com.unconference.backend.modules.schedule.domain;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of everything the assignment store owns. {@code version} grows with every committed
 * mutation, {@code catalogVersion} only with room, timeslot or session-population changes.
 */
public record ScheduleState(CatalogSnapshot catalog, Assignment assignment, long version, long catalogVersion) {

    public ScheduleState {
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(assignment, "assignment");
    }

    public static ScheduleState initial(CatalogSnapshot catalog, Assignment assignment) {
        return new ScheduleState(catalog, assignment, 0L, 0L);
    }

    public ScheduleState advance(CatalogSnapshot nextCatalog, Assignment nextAssignment, boolean catalogChanged) {
        return new ScheduleState(nextCatalog, nextAssignment, version + 1, catalogChanged ? catalogVersion + 1 : catalogVersion);
    }

    /**
     * State reloaded from the database after the cached copy drifted. Both counters move on, so
     * expected versions and generation results taken from the drifted copy are rejected.
     */
    public ScheduleState resynced(CatalogSnapshot reloadedCatalog, Assignment reloadedAssignment) {
        return new ScheduleState(reloadedCatalog, reloadedAssignment, version + 1, catalogVersion + 1);
    }

    /**
     * Entries in the catalog's slot order.
     */
    public List<AssignmentEntry> orderedEntries() {
        return assignment.entries().stream()
                .sorted((left, right) -> catalog.slotOrder().compare(left.slot(), right.slot()))
                .toList();
    }

    public Set<UUID> assignedSessionIds() {
        return assignment.entries().stream().map(AssignmentEntry::sessionId).collect(Collectors.toSet());
    }

    public static Set<UUID> sessionIdsOf(Collection<AssignmentEntry> entries) {
        return entries.stream().map(AssignmentEntry::sessionId).collect(Collectors.toSet());
    }
}
