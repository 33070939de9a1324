package com.unconference.backend.modules.schedule.application;

import static com.unconference.backend.support.ScheduleFixtures.LATE_MORNING;
import static com.unconference.backend.support.ScheduleFixtures.MORNING;
import static com.unconference.backend.support.ScheduleFixtures.ROOM_A;
import static com.unconference.backend.support.ScheduleFixtures.ROOM_B;
import static com.unconference.backend.support.ScheduleFixtures.ROOM_C;
import static com.unconference.backend.support.ScheduleFixtures.SESSION_SEVEN_FIRST;
import static com.unconference.backend.support.ScheduleFixtures.SESSION_TEN;
import static com.unconference.backend.support.ScheduleFixtures.slot;
import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

import com.unconference.backend.global.security.CallerRole;
import com.unconference.backend.modules.schedule.domain.Assignment;
import com.unconference.backend.modules.schedule.domain.AssignmentEntry;
import com.unconference.backend.modules.schedule.domain.CatalogSnapshot;
import com.unconference.backend.modules.schedule.domain.ScheduleState;
import com.unconference.backend.modules.schedule.domain.SessionSnapshot;
import com.unconference.backend.modules.schedule.domain.Slot;
import com.unconference.backend.modules.schedule.presentation.dto.ScheduleResponse;
import com.unconference.backend.support.InMemorySchedulePersistence;
import com.unconference.backend.support.InMemorySessionDirectory;
import com.unconference.backend.support.ScheduleFixtures;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AssignmentStoreConcurrencyTest {

    private static final int WRITERS = 6;
    private static final int SWAPS_PER_WRITER = 100;
    private static final int OPPOSING_ROUNDS = 200;
    private static final String COMMITTED = "COMMITTED";

    private InMemorySchedulePersistence persistence;
    private InMemorySessionDirectory sessions;
    private GenerationCoordinator coordinator;
    private AssignmentStore store;
    private ScheduleMutationService service;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        persistence = new InMemorySchedulePersistence(ScheduleFixtures.threeRooms(), ScheduleFixtures.dayWithLunch());
        sessions = new InMemorySessionDirectory(ScheduleFixtures.votedSessions());
        store = new AssignmentStore(persistence, sessions);
        coordinator = new GenerationCoordinator();
        service = serviceWith(new ScheduleOptimizer(10_000, Duration.ofSeconds(5), false, Clock.systemUTC()));
        executor = Executors.newFixedThreadPool(WRITERS + 1);
    }

    private ScheduleMutationService serviceWith(ScheduleOptimizer optimizer) {
        return new ScheduleMutationService(store, optimizer, coordinator, sessions, new ScheduleReadService(store, sessions));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("readers never observe a half-applied swap")
    void concurrentSwapsStayAtomic() throws Exception {
        service.generate(CallerRole.FACILITATOR);
        long startVersion = store.snapshot().version();

        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean writing = new AtomicBoolean(true);
        ConcurrentLinkedQueue<String> anomalies = new ConcurrentLinkedQueue<>();

        Future<?> reader = executor.submit(() -> {
            await(start);
            while (writing.get()) {
                ScheduleState state = store.snapshot();
                Assignment assignment = state.assignment();
                Set<UUID> pair = Set.of(
                        assignment.sessionAt(slot(ROOM_A, MORNING)).orElse(placeholder(0)),
                        assignment.sessionAt(slot(ROOM_B, MORNING)).orElse(placeholder(1)));
                if (!pair.equals(Set.of(SESSION_TEN, SESSION_SEVEN_FIRST)) || assignment.size() != 4) {
                    anomalies.add("version " + state.version() + ": " + assignment);
                }
            }
        });

        List<Future<?>> writers = new ArrayList<>();
        for (int i = 0; i < WRITERS; i++) {
            writers.add(executor.submit(() -> {
                await(start);
                for (int n = 0; n < SWAPS_PER_WRITER; n++) {
                    service.swap(CallerRole.FACILITATOR, slot(ROOM_A, MORNING), slot(ROOM_B, MORNING), null, null, null);
                }
            }));
        }

        start.countDown();
        for (Future<?> writer : writers) {
            writer.get(30, TimeUnit.SECONDS);
        }
        writing.set(false);
        reader.get(30, TimeUnit.SECONDS);

        ScheduleState end = store.snapshot();
        assertThat(anomalies).isEmpty();
        assertThat(end.version()).isEqualTo(startVersion + WRITERS * SWAPS_PER_WRITER);
        assertThat(end.assignment().sessionAt(slot(ROOM_A, MORNING))).contains(SESSION_TEN);
        assertThat(persistence.storedEntries()).containsExactlyInAnyOrderElementsOf(end.assignment().entries());
        assertThat(persistence.storedEntries()).extracting(AssignmentEntry::sessionId).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("opposite moves between two occupied slots never lose a session")
    void opposingMovesStayAtomic() throws Exception {
        service.generate(CallerRole.FACILITATOR);
        Slot left = slot(ROOM_A, MORNING);
        Slot right = slot(ROOM_B, MORNING);

        for (int round = 0; round < OPPOSING_ROUNDS; round++) {
            Assignment before = store.snapshot().assignment();
            UUID inLeft = before.sessionAt(left).orElseThrow();
            UUID inRight = before.sessionAt(right).orElseThrow();
            CountDownLatch start = new CountDownLatch(1);

            Future<String> leftToRight = executor.submit(() -> {
                await(start);
                return outcomeOf(() -> service.move(CallerRole.FACILITATOR, left, right, inLeft, null));
            });
            Future<String> rightToLeft = executor.submit(() -> {
                await(start);
                return outcomeOf(() -> service.move(CallerRole.FACILITATOR, right, left, inRight, null));
            });
            start.countDown();

            List<String> outcomes = List.of(leftToRight.get(10, TimeUnit.SECONDS), rightToLeft.get(10, TimeUnit.SECONDS));
            assertThat(outcomes).allMatch(outcome -> outcome.equals(COMMITTED) || outcome.equals("STALE_SCHEDULE"));
            assertThat(outcomes).contains(COMMITTED);

            Assignment after = store.snapshot().assignment();
            assertThat(after.size()).isEqualTo(4);
            assertThat(Set.of(after.sessionAt(left).orElseThrow(), after.sessionAt(right).orElseThrow()))
                    .containsExactlyInAnyOrder(inLeft, inRight);
        }
        assertThat(persistence.storedEntries()).containsExactlyInAnyOrderElementsOf(store.snapshot().assignment().entries());
    }

    @Test
    @DisplayName("an editor's move commits while a generate run is still optimizing")
    void generateOptimizesOutsideTheWriterLock() throws Exception {
        service.generate(CallerRole.FACILITATOR);
        CountDownLatch optimizing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ScheduleMutationService slowGenerator = serviceWith(
                new ScheduleOptimizer(10_000, Duration.ofSeconds(5), false, Clock.systemUTC()) {
                    @Override
                    public OptimizationResult optimize(CatalogSnapshot catalog, Collection<SessionSnapshot> input,
                                                       BooleanSupplier cancelled) {
                        optimizing.countDown();
                        await(release);
                        return super.optimize(catalog, input, cancelled);
                    }
                });

        Future<ScheduleResponse> generation = executor.submit(() -> slowGenerator.generate(CallerRole.FACILITATOR));
        assertThat(optimizing.await(10, TimeUnit.SECONDS)).isTrue();

        Future<?> move = executor.submit(() ->
                service.move(CallerRole.FACILITATOR, slot(ROOM_A, MORNING), slot(ROOM_C, LATE_MORNING), SESSION_TEN, 1L));
        move.get(10, TimeUnit.SECONDS);

        assertThat(generation).isNotDone();
        assertThat(store.snapshot().assignment().sessionAt(slot(ROOM_C, LATE_MORNING))).contains(SESSION_TEN);

        release.countDown();
        ScheduleResponse generated = generation.get(10, TimeUnit.SECONDS);
        assertThat(generated.version()).isEqualTo(3);
        assertThat(generated.entries()).hasSize(4);
    }

    private static String outcomeOf(Runnable edit) {
        try {
            edit.run();
            return COMMITTED;
        } catch (ScheduleConflictException ex) {
            return ex.getCode();
        }
    }

    private static UUID placeholder(long value) {
        return new UUID(0L, value);
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(ex);
        }
    }
}
