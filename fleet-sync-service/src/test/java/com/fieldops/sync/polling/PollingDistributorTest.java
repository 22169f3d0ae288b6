package com.fieldops.sync.polling;

import com.fieldops.common.model.FetchResult;
import com.fieldops.common.model.PollUpdate;
import com.fieldops.common.model.SourceTag;
import com.fieldops.sync.support.SchedulerClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verification of {@link PollingDistributor} on virtual time with a 30s interval.
 */
class PollingDistributorTest {

    private static final Duration INTERVAL = Duration.ofSeconds(30);

    private VirtualTimeScheduler time;
    private SchedulerClock clock;
    private AtomicInteger fetches;
    private List<PollUpdate<String>> updates;

    @BeforeEach
    void setUp() {
        time    = VirtualTimeScheduler.create();
        clock   = new SchedulerClock(time);
        fetches = new AtomicInteger();
        updates = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        time.dispose();
    }

    private PollingDistributor distributor(LateDeliveryPolicy policy) {
        return new PollingDistributor(time, clock, policy);
    }

    private Mono<FetchResult<String>> fetchOk() {
        int n = fetches.incrementAndGet();
        return Mono.just(FetchResult.network("snapshot-" + n, clock.instant()));
    }

    private static List<Long> sequences(List<PollUpdate<String>> delivered) {
        return delivered.stream().map(PollUpdate::sequenceNumber).toList();
    }

    // ── cycles ───────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("cycles")
    class CycleTests {

        @Test
        @DisplayName("first cycle runs immediately, then one per interval")
        void immediateThenInterval() {
            PollingDistributor distributor = distributor(LateDeliveryPolicy.DELIVER);

            distributor.start("fleet", PollingDistributorTest.this::fetchOk, updates::add, INTERVAL);
            assertEquals(1, updates.size());

            time.advanceTimeBy(INTERVAL.minusMillis(1));
            assertEquals(1, updates.size());

            time.advanceTimeBy(Duration.ofMillis(1));
            time.advanceTimeBy(INTERVAL.multipliedBy(2));

            assertEquals(List.of(1L, 2L, 3L, 4L), sequences(updates));
            assertEquals("snapshot-4", updates.get(3).payload());
            assertEquals(SourceTag.NETWORK, updates.get(3).source());
            assertEquals("fleet", updates.get(3).session());
            assertEquals(SchedulerClock.ORIGIN.plus(INTERVAL.multipliedBy(3)), updates.get(3).timestamp());
        }

        @Test
        @DisplayName("failed fetch → error update; the session keeps running")
        void errorUpdate() {
            PollingDistributor distributor = distributor(LateDeliveryPolicy.DELIVER);
            AtomicInteger cycle = new AtomicInteger();

            distributor.start("fleet", () -> cycle.incrementAndGet() == 1
                    ? Mono.error(new IllegalStateException("remote unreachable"))
                    : fetchOk(),
                updates::add, INTERVAL);
            time.advanceTimeBy(INTERVAL);

            assertEquals(2, updates.size());
            PollUpdate<String> failed = updates.get(0);
            assertTrue(failed.isError());
            assertNull(failed.payload());
            assertEquals("remote unreachable", failed.error());
            assertEquals(1L, failed.sequenceNumber());
            assertFalse(updates.get(1).isError());
            assertEquals(2L, updates.get(1).sequenceNumber());
        }

        @Test
        @DisplayName("fetch that completes empty or throws is an error update")
        void malformedFetch() {
            PollingDistributor distributor = distributor(LateDeliveryPolicy.DELIVER);
            AtomicInteger cycle = new AtomicInteger();

            distributor.<String>start("fleet", () -> {
                if (cycle.incrementAndGet() == 1) {
                    return Mono.empty();
                }
                throw new IllegalArgumentException("bad dataset");
            }, updates::add, INTERVAL);
            time.advanceTimeBy(INTERVAL);

            assertEquals(2, updates.size());
            assertTrue(updates.get(0).error().contains("without a result"));
            assertEquals("bad dataset", updates.get(1).error());
        }

        @Test
        @DisplayName("a throwing callback does not stop the loop")
        void callbackThrows() {
            PollingDistributor distributor = distributor(LateDeliveryPolicy.DELIVER);

            distributor.start("fleet", PollingDistributorTest.this::fetchOk, update -> {
                updates.add(update);
                if (update.sequenceNumber() == 1) {
                    throw new IllegalStateException("render failed");
                }
            }, INTERVAL);
            time.advanceTimeBy(INTERVAL);

            assertEquals(List.of(1L, 2L), sequences(updates));
            assertTrue(distributor.isActive("fleet"));
        }

        @Test
        @DisplayName("ticks during a running cycle are skipped, not queued")
        void overlappingTicks() {
            PollingDistributor distributor = distributor(LateDeliveryPolicy.DELIVER);
            Sinks.One<FetchResult<String>> slow = Sinks.one();

            PollSession session = distributor.start("fleet", () -> {
                fetches.incrementAndGet();
                return slow.asMono();
            }, updates::add, INTERVAL);
            time.advanceTimeBy(INTERVAL.multipliedBy(3));

            assertEquals(1, fetches.get());
            assertEquals(3, session.skippedCycles());

            slow.tryEmitValue(FetchResult.network("late", clock.instant()));
            assertEquals(1, updates.size());

            time.advanceTimeBy(INTERVAL);
            assertEquals(2, fetches.get());
        }
    }

    // ── stop ─────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("stop()")
    class StopTests {

        @Test
        @DisplayName("stop cancels future cycles and is idempotent")
        void stopIdempotent() {
            PollingDistributor distributor = distributor(LateDeliveryPolicy.DELIVER);
            distributor.start("fleet", PollingDistributorTest.this::fetchOk, updates::add, INTERVAL);

            distributor.stop("fleet");
            assertDoesNotThrow(() -> distributor.stop("fleet"));
            assertDoesNotThrow(() -> distributor.stop("never-started"));
            time.advanceTimeBy(INTERVAL.multipliedBy(5));

            assertEquals(1, updates.size());
            assertFalse(distributor.isActive("fleet"));
            assertTrue(distributor.activeSessions().isEmpty());
        }

        @Test
        @DisplayName("DELIVER: a cycle in flight at stop still delivers")
        void lateDelivered() {
            PollingDistributor distributor = distributor(LateDeliveryPolicy.DELIVER);
            Sinks.One<FetchResult<String>> slow = Sinks.one();
            PollSession session = distributor.start("fleet", slow::asMono, updates::add, INTERVAL);

            distributor.stop("fleet");
            slow.tryEmitValue(FetchResult.network("late", clock.instant()));

            assertEquals(1, updates.size());
            assertEquals("late", updates.get(0).payload());
            assertEquals(1L, session.deliveredCount());
        }

        @Test
        @DisplayName("DROP: a cycle in flight at stop is discarded")
        void lateDropped() {
            PollingDistributor distributor = distributor(LateDeliveryPolicy.DROP);
            Sinks.One<FetchResult<String>> slow = Sinks.one();
            PollSession session = distributor.start("fleet", slow::asMono, updates::add, INTERVAL);

            distributor.stop("fleet");
            slow.tryEmitValue(FetchResult.network("late", clock.instant()));

            assertTrue(updates.isEmpty());
            assertEquals(0L, session.deliveredCount());
        }

        @Test
        @DisplayName("stopAll stops every session")
        void stopAll() {
            PollingDistributor distributor = distributor(LateDeliveryPolicy.DELIVER);
            distributor.start("a", PollingDistributorTest.this::fetchOk, updates::add, INTERVAL);
            distributor.start("b", PollingDistributorTest.this::fetchOk, updates::add, INTERVAL);

            distributor.stopAll();
            time.advanceTimeBy(INTERVAL.multipliedBy(2));

            assertEquals(2, updates.size());
            assertTrue(distributor.activeSessions().isEmpty());
        }
    }

    // ── sessions ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("sessions")
    class SessionTests {

        @Test
        @DisplayName("sessions have independent sequences and lifetimes")
        void independent() {
            PollingDistributor distributor = distributor(LateDeliveryPolicy.DELIVER);
            List<PollUpdate<String>> other = new CopyOnWriteArrayList<>();

            distributor.start("a", PollingDistributorTest.this::fetchOk, updates::add, INTERVAL);
            distributor.start("b", PollingDistributorTest.this::fetchOk, other::add, Duration.ofSeconds(10));
            time.advanceTimeBy(INTERVAL);
            distributor.stop("b");
            time.advanceTimeBy(INTERVAL);

            assertEquals(List.of(1L, 2L, 3L), sequences(updates));
            assertEquals(List.of(1L, 2L, 3L, 4L), sequences(other));

            List<PollSessionStatus> active = distributor.activeSessions();
            assertEquals(1, active.size());
            assertEquals("a", active.get(0).name());
            assertEquals(3L, active.get(0).deliveredCount());
        }

        @Test
        @DisplayName("session status delivered count tracks the last sequence number")
        void statusTracksSequence() {
            PollingDistributor distributor = distributor(LateDeliveryPolicy.DELIVER);
            distributor.start("fleet", PollingDistributorTest.this::fetchOk, updates::add, INTERVAL);
            time.advanceTimeBy(INTERVAL.multipliedBy(4));

            PollSessionStatus status = distributor.activeSessions().get(0);

            assertEquals(5, updates.size());
            assertEquals(updates.get(4).sequenceNumber(), status.deliveredCount());
            assertEquals(INTERVAL, status.interval());
            assertEquals(0L, status.skippedCycles());
        }

        @Test
        @DisplayName("starting an existing name replaces the running session")
        void replace() {
            PollingDistributor distributor = distributor(LateDeliveryPolicy.DELIVER);
            List<PollUpdate<String>> replacement = new CopyOnWriteArrayList<>();

            PollSession first = distributor.start("fleet", PollingDistributorTest.this::fetchOk, updates::add, INTERVAL);
            distributor.start("fleet", PollingDistributorTest.this::fetchOk, replacement::add, INTERVAL);
            time.advanceTimeBy(INTERVAL);

            assertTrue(first.isStopped());
            assertEquals(1, updates.size());
            assertEquals(List.of(1L, 2L), sequences(replacement));
            assertEquals(1, distributor.activeSessions().size());
        }
    }
}
