package com.unconference.backend.modules.schedule.application;

import static com.unconference.backend.support.ScheduleFixtures.LATE_MORNING;
import static com.unconference.backend.support.ScheduleFixtures.MORNING;
import static com.unconference.backend.support.ScheduleFixtures.ROOM_A;
import static com.unconference.backend.support.ScheduleFixtures.ROOM_B;
import static com.unconference.backend.support.ScheduleFixtures.ROOM_C;
import static com.unconference.backend.support.ScheduleFixtures.SESSION_ONE;
import static com.unconference.backend.support.ScheduleFixtures.SESSION_SEVEN_FIRST;
import static com.unconference.backend.support.ScheduleFixtures.SESSION_SEVEN_SECOND;
import static com.unconference.backend.support.ScheduleFixtures.SESSION_TEN;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.unconference.backend.modules.schedule.domain.AssignmentEntry;
import com.unconference.backend.modules.schedule.domain.AssignmentValidator;
import com.unconference.backend.modules.schedule.domain.CatalogSnapshot;
import com.unconference.backend.modules.schedule.domain.SessionSnapshot;
import com.unconference.backend.modules.schedule.domain.TimeslotSnapshot;
import com.unconference.backend.support.ScheduleFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ScheduleOptimizerTest {

    private Clock clock;
    private ScheduleOptimizer optimizer;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(OffsetDateTime.parse("2026-03-14T08:00:00Z").toInstant(), ZoneOffset.UTC);
        optimizer = new ScheduleOptimizer(10_000, Duration.ofSeconds(5), false, clock);
    }

    @Test
    @DisplayName("most voted sessions take the earliest slots and empty slots remain when sessions run out")
    void placesByInterest() {
        CatalogSnapshot catalog = CatalogSnapshot.of(ScheduleFixtures.threeRooms(), ScheduleFixtures.dayWithLunch());

        OptimizationResult result = optimizer.optimize(catalog, ScheduleFixtures.votedSessions(), () -> false);

        assertThat(result.entries()).containsExactly(
                AssignmentEntry.of(ROOM_A, MORNING, SESSION_TEN),
                AssignmentEntry.of(ROOM_B, MORNING, SESSION_SEVEN_FIRST),
                AssignmentEntry.of(ROOM_C, MORNING, SESSION_SEVEN_SECOND),
                AssignmentEntry.of(ROOM_A, LATE_MORNING, SESSION_ONE)
        );
        assertThat(result.capturedVotes()).isEqualTo(25);
        assertThat(result.converged()).isTrue();
        assertThat(AssignmentValidator.validate(result.entries(), catalog.rooms(), catalog.timeslots(),
                Set.of(SESSION_TEN, SESSION_SEVEN_FIRST, SESSION_SEVEN_SECOND, SESSION_ONE))).isEmpty();
    }

    @Test
    @DisplayName("when slots run short the least voted session stays unassigned")
    void dropsLeastVotedWhenFull() {
        List<TimeslotSnapshot> oneOpenTimeslot = List.of(
                ScheduleFixtures.timeslot(MORNING, 0),
                ScheduleFixtures.blockedTimeslot(LATE_MORNING, 1, "Keynote")
        );
        CatalogSnapshot catalog = CatalogSnapshot.of(ScheduleFixtures.threeRooms(), oneOpenTimeslot);

        OptimizationResult result = optimizer.optimize(catalog, ScheduleFixtures.votedSessions(), () -> false);

        assertThat(result.entries()).extracting(AssignmentEntry::sessionId)
                .containsExactlyInAnyOrder(SESSION_TEN, SESSION_SEVEN_FIRST, SESSION_SEVEN_SECOND);
        assertThat(result.entries()).allSatisfy(entry -> assertThat(entry.slot().timeslotId()).isEqualTo(MORNING));
        assertThat(result.capturedVotes()).isEqualTo(24);
    }

    @Test
    @DisplayName("the same input always yields the same assignment")
    void isDeterministic() {
        CatalogSnapshot catalog = CatalogSnapshot.of(ScheduleFixtures.threeRooms(), ScheduleFixtures.dayWithLunch());
        List<SessionSnapshot> sessions = manySessions(11);
        List<SessionSnapshot> reversed = new ArrayList<>(sessions);
        Collections.reverse(reversed);

        OptimizationResult first = optimizer.optimize(catalog, sessions, () -> false);
        OptimizationResult second = optimizer.optimize(catalog, reversed, () -> false);

        assertThat(second.entries()).isEqualTo(first.entries());
    }

    @Test
    @DisplayName("no unassigned session could replace an assigned one with fewer votes")
    void resultIsLocallyOptimal() {
        CatalogSnapshot catalog = CatalogSnapshot.of(ScheduleFixtures.threeRooms(), ScheduleFixtures.dayWithLunch());
        List<SessionSnapshot> sessions = manySessions(11);

        OptimizationResult result = optimizer.optimize(catalog, sessions, () -> false);

        Map<UUID, Integer> votes = sessions.stream().collect(Collectors.toMap(SessionSnapshot::id, SessionSnapshot::voteCount));
        Set<UUID> assigned = result.entries().stream().map(AssignmentEntry::sessionId).collect(Collectors.toSet());
        int weakestAssigned = assigned.stream().mapToInt(votes::get).min().orElseThrow();
        int strongestUnassigned = sessions.stream()
                .filter(session -> !assigned.contains(session.id()))
                .mapToInt(SessionSnapshot::voteCount)
                .max()
                .orElseThrow();

        assertThat(result.entries()).hasSize(6);
        assertThat(strongestUnassigned).isLessThanOrEqualTo(weakestAssigned);
    }

    @Test
    @DisplayName("no rooms or no open timeslots yields an empty assignment")
    void emptyCatalog() {
        CatalogSnapshot noRooms = CatalogSnapshot.of(List.of(), ScheduleFixtures.dayWithLunch());
        CatalogSnapshot onlyBlocked = CatalogSnapshot.of(
                ScheduleFixtures.threeRooms(),
                List.of(ScheduleFixtures.blockedTimeslot(MORNING, 0, "Opening circle")));

        assertThat(optimizer.optimize(noRooms, ScheduleFixtures.votedSessions(), () -> false).entries()).isEmpty();
        assertThat(optimizer.optimize(onlyBlocked, ScheduleFixtures.votedSessions(), () -> false).entries()).isEmpty();
        assertThat(optimizer.optimize(CatalogSnapshot.empty(), List.of(), () -> false).capturedVotes()).isZero();
    }

    @Test
    @DisplayName("a cancelled run aborts")
    void honoursCancellation() {
        CatalogSnapshot catalog = CatalogSnapshot.of(ScheduleFixtures.threeRooms(), ScheduleFixtures.dayWithLunch());

        assertThatThrownBy(() -> optimizer.optimize(catalog, ScheduleFixtures.votedSessions(), () -> true))
                .isInstanceOf(GenerationCancelledException.class);
    }

    @Test
    @DisplayName("a zero pass limit keeps the greedy construction and reports no convergence")
    void passLimitStopsSearch() {
        ScheduleOptimizer constructionOnly = new ScheduleOptimizer(0, Duration.ofSeconds(5), false, clock);
        CatalogSnapshot catalog = CatalogSnapshot.of(ScheduleFixtures.threeRooms(), ScheduleFixtures.dayWithLunch());

        OptimizationResult result = constructionOnly.optimize(catalog, ScheduleFixtures.votedSessions(), () -> false);

        assertThat(result.entries()).hasSize(4);
        assertThat(result.passes()).isZero();
        assertThat(result.converged()).isFalse();
    }

    @Test
    @DisplayName("spreading keeps the vote total and separates popular sessions")
    void spreadsPopularSessions() {
        UUID first = UUID.fromString("00000000-0000-0000-0000-000000000401");
        UUID second = UUID.fromString("00000000-0000-0000-0000-000000000402");
        UUID third = UUID.fromString("00000000-0000-0000-0000-000000000403");
        UUID fourth = UUID.fromString("00000000-0000-0000-0000-000000000404");
        List<SessionSnapshot> sessions = List.of(
                ScheduleFixtures.session(first, 10),
                ScheduleFixtures.session(second, 9),
                ScheduleFixtures.session(third, 1),
                ScheduleFixtures.session(fourth, 1)
        );
        CatalogSnapshot catalog = CatalogSnapshot.of(
                List.of(ScheduleFixtures.room(ROOM_A, "Atrium"), ScheduleFixtures.room(ROOM_B, "Boiler Room")),
                List.of(ScheduleFixtures.timeslot(MORNING, 0), ScheduleFixtures.timeslot(LATE_MORNING, 1)));
        ScheduleOptimizer spreading = new ScheduleOptimizer(10_000, Duration.ofSeconds(5), true, clock);

        OptimizationResult plain = optimizer.optimize(catalog, sessions, () -> false);
        OptimizationResult spread = spreading.optimize(catalog, sessions, () -> false);

        Map<UUID, AssignmentEntry> bySession = spread.entries().stream()
                .collect(Collectors.toMap(AssignmentEntry::sessionId, Function.identity()));
        assertThat(spread.capturedVotes()).isEqualTo(plain.capturedVotes()).isEqualTo(21);
        assertThat(plain.overlapPenalty()).isZero();
        assertThat(spread.overlapPenalty()).isEqualTo(19);
        assertThat(bySession.get(first).slot().timeslotId()).isNotEqualTo(bySession.get(second).slot().timeslotId());
    }

    @Test
    @DisplayName("equal votes go to the lower id in database order")
    void tiesPreferLowerIdUnsigned() {
        UUID low = UUID.fromString("10000000-0000-0000-0000-000000000000");
        UUID high = UUID.fromString("90000000-0000-0000-0000-000000000000");
        CatalogSnapshot oneSlot = CatalogSnapshot.of(
                List.of(ScheduleFixtures.room(ROOM_A, "Atrium")),
                List.of(ScheduleFixtures.timeslot(MORNING, 0)));

        OptimizationResult result = optimizer.optimize(oneSlot,
                List.of(ScheduleFixtures.session(high, 7), ScheduleFixtures.session(low, 7)), () -> false);

        assertThat(result.entries()).extracting(AssignmentEntry::sessionId).containsExactly(low);
    }

    private static List<SessionSnapshot> manySessions(int count) {
        List<SessionSnapshot> sessions = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            UUID id = UUID.fromString("00000000-0000-0000-0000-%012d".formatted(500 + i));
            sessions.add(ScheduleFixtures.session(id, (i * 7) % 5));
        }
        return sessions;
    }
}
