package com.unconference.backend.modules.schedule.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.BooleanSupplier;

import com.unconference.backend.modules.schedule.domain.AssignmentEntry;
import com.unconference.backend.modules.schedule.domain.CatalogSnapshot;
import com.unconference.backend.modules.schedule.domain.SessionSnapshot;
import com.unconference.backend.modules.schedule.domain.Slot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Builds a schedule that maximizes the captured vote count.
 *
 * <p>A greedy pass hands the most popular sessions the earliest eligible slots, then a first-improvement
 * local search applies single placements, replacements, swaps and relocations until none improves the
 * score. The score is the captured vote sum; when {@code spread-popular-sessions} is enabled ties are
 * broken by an overlap penalty that keeps popular sessions out of the same timeslot.</p>
 *
 * <p>Stateless apart from its settings, safe to call from several threads.</p>
 */
@Component
public class ScheduleOptimizer {

    private static final Logger log = LoggerFactory.getLogger(ScheduleOptimizer.class);

    private static final int EMPTY = -1;

    private final int maxPasses;
    private final Duration timeBudget;
    private final boolean spreadPopularSessions;
    private final Clock clock;

    public ScheduleOptimizer(
            @Value("${app.schedule.optimizer.max-passes:10000}") int maxPasses,
            @Value("${app.schedule.optimizer.time-budget:PT5S}") Duration timeBudget,
            @Value("${app.schedule.optimizer.spread-popular-sessions:false}") boolean spreadPopularSessions,
            Clock clock
    ) {
        if (maxPasses < 0) {
            throw new IllegalArgumentException("app.schedule.optimizer.max-passes must be >= 0");
        }
        if (timeBudget.isNegative()) {
            throw new IllegalArgumentException("app.schedule.optimizer.time-budget must not be negative");
        }
        this.maxPasses = maxPasses;
        this.timeBudget = timeBudget;
        this.spreadPopularSessions = spreadPopularSessions;
        this.clock = clock;
    }

    /**
     * @param cancelled polled between moves; once it reports true the run aborts
     * @throws GenerationCancelledException when {@code cancelled} turns true before the run finishes
     */
    public OptimizationResult optimize(
            CatalogSnapshot catalog,
            Collection<SessionSnapshot> sessions,
            BooleanSupplier cancelled
    ) {
        List<Slot> slots = catalog.eligibleSlots();
        List<SessionSnapshot> ordered = sessions.stream()
                .sorted(SessionSnapshot.BY_INTEREST)
                .toList();
        if (slots.isEmpty() || ordered.isEmpty()) {
            log.debug("Nothing to optimize: eligibleSlots={}, sessions={}", slots.size(), ordered.size());
            return new OptimizationResult(List.of(), 0L, 0L, 0, true);
        }

        Board board = new Board(slots, ordered, spreadPopularSessions);
        board.construct();

        Instant deadline = clock.instant().plus(timeBudget);
        int passes = 0;
        boolean converged = false;
        while (passes < maxPasses) {
            checkCancelled(cancelled);
            if (!clock.instant().isBefore(deadline)) {
                log.warn("Schedule optimization stopped by time budget {} after {} passes", timeBudget, passes);
                break;
            }
            passes++;
            if (!board.improveOnce(cancelled)) {
                converged = true;
                break;
            }
        }

        List<AssignmentEntry> entries = board.entries();
        long penalty = spreadPopularSessions ? board.totalPenalty() : 0L;
        log.info("Optimized schedule: placed={}/{}, slots={}, votes={}, penalty={}, passes={}, converged={}",
                entries.size(), ordered.size(), slots.size(), board.capturedVotes(), penalty, passes, converged);
        return new OptimizationResult(entries, board.capturedVotes(), penalty, passes, converged);
    }

    private static void checkCancelled(BooleanSupplier cancelled) {
        if (cancelled.getAsBoolean()) {
            throw new GenerationCancelledException();
        }
    }

    /**
     * Index-based working copy of one optimization run. Sessions are indexed in interest order and
     * slots in catalog slot order, so every scan below is deterministic.
     */
    private static final class Board {

        private final List<Slot> slots;
        private final List<SessionSnapshot> sessions;
        private final boolean spread;
        private final int[] slotSession;
        private final int[] sessionSlot;
        private final int[] slotGroup;
        private final List<int[]> groups;

        Board(List<Slot> slots, List<SessionSnapshot> sessions, boolean spread) {
            this.slots = slots;
            this.sessions = sessions;
            this.spread = spread;
            this.slotSession = new int[slots.size()];
            this.sessionSlot = new int[sessions.size()];
            Arrays.fill(slotSession, EMPTY);
            Arrays.fill(sessionSlot, EMPTY);

            this.slotGroup = new int[slots.size()];
            Map<UUID, List<Integer>> byTimeslot = new HashMap<>();
            List<UUID> timeslotOrder = new ArrayList<>();
            for (int i = 0; i < slots.size(); i++) {
                UUID timeslotId = slots.get(i).timeslotId();
                List<Integer> members = byTimeslot.get(timeslotId);
                if (members == null) {
                    members = new ArrayList<>();
                    byTimeslot.put(timeslotId, members);
                    timeslotOrder.add(timeslotId);
                }
                members.add(i);
            }
            this.groups = new ArrayList<>(timeslotOrder.size());
            for (UUID timeslotId : timeslotOrder) {
                int group = groups.size();
                int[] members = byTimeslot.get(timeslotId).stream().mapToInt(Integer::intValue).toArray();
                for (int slot : members) {
                    slotGroup[slot] = group;
                }
                groups.add(members);
            }
        }

        void construct() {
            int placed = Math.min(slots.size(), sessions.size());
            for (int i = 0; i < placed; i++) {
                place(i, i);
            }
        }

        boolean improveOnce(BooleanSupplier cancelled) {
            for (int session = 0; session < sessions.size(); session++) {
                if (sessionSlot[session] != EMPTY || votes(session) == 0) {
                    continue;
                }
                for (int slot = 0; slot < slots.size(); slot++) {
                    if (slotSession[slot] == EMPTY) {
                        place(session, slot);
                        return true;
                    }
                }
            }

            for (int session = 0; session < sessions.size(); session++) {
                if (sessionSlot[session] != EMPTY) {
                    continue;
                }
                checkCancelled(cancelled);
                for (int slot = 0; slot < slots.size(); slot++) {
                    int current = slotSession[slot];
                    if (current != EMPTY && votes(session) > votes(current)) {
                        unplace(current);
                        place(session, slot);
                        return true;
                    }
                }
            }

            if (!spread) {
                return false;
            }

            for (int first = 0; first < slots.size(); first++) {
                if (slotSession[first] == EMPTY) {
                    continue;
                }
                checkCancelled(cancelled);
                for (int second = first + 1; second < slots.size(); second++) {
                    if (slotSession[second] == EMPTY || slotGroup[first] == slotGroup[second]
                            || votes(slotSession[first]) == votes(slotSession[second])) {
                        continue;
                    }
                    if (trySwap(first, second)) {
                        return true;
                    }
                }
            }

            for (int from = 0; from < slots.size(); from++) {
                if (slotSession[from] == EMPTY) {
                    continue;
                }
                checkCancelled(cancelled);
                for (int to = 0; to < slots.size(); to++) {
                    if (slotSession[to] != EMPTY || slotGroup[from] == slotGroup[to]) {
                        continue;
                    }
                    if (tryRelocate(from, to)) {
                        return true;
                    }
                }
            }
            return false;
        }

        private boolean trySwap(int first, int second) {
            long before = groupPenalty(slotGroup[first]) + groupPenalty(slotGroup[second]);
            swap(first, second);
            long after = groupPenalty(slotGroup[first]) + groupPenalty(slotGroup[second]);
            if (after < before) {
                return true;
            }
            swap(first, second);
            return false;
        }

        private boolean tryRelocate(int from, int to) {
            int session = slotSession[from];
            long before = groupPenalty(slotGroup[from]) + groupPenalty(slotGroup[to]);
            unplace(session);
            place(session, to);
            long after = groupPenalty(slotGroup[from]) + groupPenalty(slotGroup[to]);
            if (after < before) {
                return true;
            }
            unplace(session);
            place(session, from);
            return false;
        }

        private void swap(int first, int second) {
            int a = slotSession[first];
            int b = slotSession[second];
            slotSession[first] = b;
            slotSession[second] = a;
            sessionSlot[a] = second;
            sessionSlot[b] = first;
        }

        private void place(int session, int slot) {
            slotSession[slot] = session;
            sessionSlot[session] = slot;
        }

        private void unplace(int session) {
            slotSession[sessionSlot[session]] = EMPTY;
            sessionSlot[session] = EMPTY;
        }

        private int votes(int session) {
            return sessions.get(session).voteCount();
        }

        /**
         * Sum of the products of neighbouring vote counts once the timeslot's sessions are sorted by
         * votes descending.
         */
        private long groupPenalty(int group) {
            int[] members = groups.get(group);
            long[] values = new long[members.length];
            int count = 0;
            for (int slot : members) {
                if (slotSession[slot] != EMPTY) {
                    values[count++] = votes(slotSession[slot]);
                }
            }
            long[] sorted = Arrays.copyOf(values, count);
            Arrays.sort(sorted);
            long penalty = 0L;
            for (int i = sorted.length - 1; i > 0; i--) {
                penalty += sorted[i] * sorted[i - 1];
            }
            return penalty;
        }

        long totalPenalty() {
            long total = 0L;
            for (int group = 0; group < groups.size(); group++) {
                total += groupPenalty(group);
            }
            return total;
        }

        long capturedVotes() {
            long total = 0L;
            for (int session : slotSession) {
                if (session != EMPTY) {
                    total += votes(session);
                }
            }
            return total;
        }

        List<AssignmentEntry> entries() {
            List<AssignmentEntry> entries = new ArrayList<>();
            for (int slot = 0; slot < slots.size(); slot++) {
                if (slotSession[slot] != EMPTY) {
                    entries.add(new AssignmentEntry(slots.get(slot), sessions.get(slotSession[slot]).id()));
                }
            }
            return entries;
        }
    }
}
