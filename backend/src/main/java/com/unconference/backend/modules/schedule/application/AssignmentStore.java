package com.unconference.backend.modules.schedule.application;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import com.unconference.backend.global.error.ProblemException;
import com.unconference.backend.modules.schedule.domain.Assignment;
import com.unconference.backend.modules.schedule.domain.AssignmentEntry;
import com.unconference.backend.modules.schedule.domain.AssignmentValidator;
import com.unconference.backend.modules.schedule.domain.AssignmentViolation;
import com.unconference.backend.modules.schedule.domain.CatalogSnapshot;
import com.unconference.backend.modules.schedule.domain.ScheduleState;
import com.unconference.backend.modules.schedule.domain.ScheduleTransition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

/**
 * Owner of the schedule state.
 *
 * <p>Readers get the last published {@link ScheduleState} without locking. Writers serialize on a fair
 * lock and run plan, validate, persist and publish in that order; the new state becomes visible only
 * after the database accepted the transition. A database rejection reloads the state instead.</p>
 */
@Component
public class AssignmentStore {

    private static final Logger log = LoggerFactory.getLogger(AssignmentStore.class);

    private final SchedulePersistence persistence;
    private final SessionDirectory sessionDirectory;
    private final ReentrantLock writeLock = new ReentrantLock(true);

    private volatile ScheduleState state;

    public AssignmentStore(SchedulePersistence persistence, SessionDirectory sessionDirectory) {
        this.persistence = persistence;
        this.sessionDirectory = sessionDirectory;
    }

    public ScheduleState snapshot() {
        ScheduleState current = state;
        if (current != null) {
            return current;
        }
        writeLock.lock();
        try {
            return loaded();
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Runs {@code planner} against the current state under the writer lock and commits what it returns.
     * The planner rejects a request by throwing a {@link ProblemException}.
     */
    public ScheduleCommit mutate(String operation, Function<ScheduleState, ScheduleTransition> planner) {
        log.debug("Schedule mutation {} REQUESTED", operation);
        writeLock.lock();
        try {
            ScheduleState current = loaded();
            ScheduleTransition transition;
            try {
                transition = planner.apply(current);
            } catch (ProblemException ex) {
                log.info("Schedule mutation {} REJECTED code={} detail={}", operation, ex.getCode(), ex.getDetailMessage());
                throw ex;
            }
            if (transition.isEmpty()) {
                log.debug("Schedule mutation {} COMMITTED as no-op at version {}", operation, current.version());
                return new ScheduleCommit(current, transition);
            }

            CatalogSnapshot nextCatalog = transition.applyTo(current.catalog());
            List<AssignmentEntry> nextEntries = nextEntries(operation, current, transition);
            validate(operation, transition, nextCatalog, nextEntries);
            log.debug("Schedule mutation {} VALIDATED removals={} insertions={}",
                    operation, transition.removals().size(), transition.insertions().size());

            try {
                persistence.commit(transition);
            } catch (DataIntegrityViolationException ex) {
                log.warn("Schedule mutation {} REJECTED by the database: {}", operation, ex.getMostSpecificCause().getMessage());
                resync(current);
                throw ScheduleProblems.concurrentModification();
            }

            ScheduleState next = current.advance(nextCatalog, Assignment.of(nextEntries), transition.changesCatalog());
            state = next;
            log.info("Schedule mutation {} COMMITTED version={} catalogVersion={} entries={}",
                    operation, next.version(), next.catalogVersion(), next.assignment().size());
            return new ScheduleCommit(next, transition);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Drops the cached state so the next access reloads it from the database.
     */
    public void evict() {
        writeLock.lock();
        try {
            state = null;
        } finally {
            writeLock.unlock();
        }
    }

    private ScheduleState loaded() {
        ScheduleState current = state;
        if (current == null) {
            PersistedSchedule persisted = persistence.load();
            current = ScheduleState.initial(catalogOf(persisted), Assignment.of(persisted.entries()));
            state = current;
            log.info("Loaded schedule: rooms={}, timeslots={}, entries={}",
                    persisted.rooms().size(), persisted.timeslots().size(), persisted.entries().size());
        }
        return current;
    }

    /**
     * Replaces a cached state the database disagrees with, e.g. after a foreign-key cascade removed
     * rows behind the store's back. Must run under the writer lock. If the reload fails the cache
     * stays empty and the next access loads lazily.
     */
    private void resync(ScheduleState stale) {
        state = null;
        PersistedSchedule persisted = persistence.load();
        ScheduleState reloaded = stale.resynced(catalogOf(persisted), Assignment.of(persisted.entries()));
        state = reloaded;
        log.info("Reloaded schedule after database rejection: version={} entries={}",
                reloaded.version(), reloaded.assignment().size());
    }

    private static CatalogSnapshot catalogOf(PersistedSchedule persisted) {
        return CatalogSnapshot.of(persisted.rooms(), persisted.timeslots());
    }

    private static List<AssignmentEntry> nextEntries(String operation, ScheduleState current, ScheduleTransition transition) {
        try {
            return current.assignment().apply(transition);
        } catch (IllegalStateException ex) {
            log.error("Schedule mutation {} planned an inconsistent transition: {}", operation, ex.getMessage());
            throw ScheduleProblems.invariantViolation(ex.getMessage());
        }
    }

    /**
     * Sessions already on the board are trusted; only sessions entering a slot are looked up in the
     * session store.
     */
    private void validate(String operation, ScheduleTransition transition, CatalogSnapshot nextCatalog,
                          List<AssignmentEntry> nextEntries) {
        Set<UUID> incoming = ScheduleState.sessionIdsOf(transition.insertions());
        Set<UUID> knownSessions = new HashSet<>(ScheduleState.sessionIdsOf(nextEntries));
        knownSessions.removeAll(incoming);
        if (!incoming.isEmpty()) {
            knownSessions.addAll(sessionDirectory.findExistingIds(incoming));
        }

        Optional<AssignmentViolation> violation = AssignmentValidator.validate(
                nextEntries, nextCatalog.rooms(), nextCatalog.timeslots(), knownSessions);
        if (violation.isEmpty()) {
            return;
        }
        AssignmentViolation found = violation.get();
        if (found.isMissingSession(nextCatalog)) {
            log.info("Schedule mutation {} REJECTED: {}", operation, found.detail());
            throw ScheduleProblems.sessionNotFound(found.entry().sessionId());
        }
        log.error("Schedule mutation {} would break an assignment invariant: {} {}", operation, found.kind(), found.detail());
        throw ScheduleProblems.invariantViolation(found);
    }
}
