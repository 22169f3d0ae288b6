package com.fieldops.sync.polling;

import com.fieldops.common.model.FetchResult;
import com.fieldops.common.model.PollUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.LongFunction;
import java.util.function.Supplier;

/**
 * Drives fetches on a timer and hands each outcome to a subscriber callback.
 *
 * <p>Each session runs one cycle immediately, then one per interval, on a
 * {@code Flux.interval} ticker bound to the injected {@link Scheduler}. A tick that
 * arrives while the previous cycle is still running is skipped. A failed cycle
 * becomes an error {@link PollUpdate}; a callback that throws is logged. Neither
 * stops the session.
 *
 * <p>{@link #stop} cancels future ticks only. What happens to a cycle already in
 * flight is decided by the {@link LateDeliveryPolicy}.
 */
public class PollingDistributor {

    private static final Logger log = LoggerFactory.getLogger(PollingDistributor.class);

    private final Scheduler scheduler;
    private final Clock clock;
    private final LateDeliveryPolicy latePolicy;

    private final ConcurrentHashMap<String, PollSession> sessions = new ConcurrentHashMap<>();

    public PollingDistributor(Scheduler scheduler, Clock clock, LateDeliveryPolicy latePolicy) {
        this.scheduler  = scheduler;
        this.clock      = clock;
        this.latePolicy = latePolicy;
    }

    /**
     * Starts session {@code name}, replacing (and stopping) any running session of
     * the same name.
     */
    public <T> PollSession start(String name,
                                 Supplier<Mono<FetchResult<T>>> fetch,
                                 Consumer<PollUpdate<T>> callback,
                                 Duration interval) {
        PollSession session = new PollSession(name, interval);
        PollSession previous = sessions.put(name, session);
        if (previous != null && previous.stop()) {
            log.info("POLL_SESSION_REPLACED session={}", name);
        }

        Disposable ticker = Flux.interval(Duration.ZERO, interval, scheduler)
            .onBackpressureDrop()
            .subscribe(
                tick -> runCycle(session, fetch, callback),
                err -> log.error("POLL_TICKER_FAILED session={}", name, err));
        session.attach(ticker);
        if (session.isStopped()) {
            // stopped while the first tick was being scheduled
            ticker.dispose();
        }

        log.info("POLL_SESSION_STARTED session={} intervalSeconds={} latePolicy={}",
                 name, interval.toSeconds(), latePolicy);
        return session;
    }

    /** Stops session {@code name}. Unknown or already stopped sessions are ignored. */
    public void stop(String name) {
        PollSession session = sessions.remove(name);
        if (session != null && session.stop()) {
            log.info("POLL_SESSION_STOPPED session={} delivered={}", name, session.deliveredCount());
        }
    }

    public void stopAll() {
        List<String> names = new ArrayList<>(sessions.keySet());
        names.forEach(this::stop);
    }

    public boolean isActive(String name) {
        PollSession session = sessions.get(name);
        return session != null && !session.isStopped();
    }

    public List<PollSessionStatus> activeSessions() {
        return sessions.values().stream()
            .filter(s -> !s.isStopped())
            .map(PollSession::snapshot)
            .sorted(Comparator.comparing(PollSessionStatus::name))
            .toList();
    }

    public LateDeliveryPolicy latePolicy() {
        return latePolicy;
    }

    // ── private ───────────────────────────────────────────────────────────────

    private <T> void runCycle(PollSession session,
                              Supplier<Mono<FetchResult<T>>> fetch,
                              Consumer<PollUpdate<T>> callback) {
        if (session.isStopped()) {
            return;
        }
        if (!session.beginCycle()) {
            log.debug("POLL_CYCLE_SKIPPED session={} reason=previous cycle still running", session.name());
            return;
        }

        Mono<FetchResult<T>> cycle;
        try {
            cycle = fetch.get();
        } catch (RuntimeException e) {
            cycle = Mono.error(e);
        }

        cycle
            .switchIfEmpty(Mono.error(() -> new IllegalStateException("fetch completed without a result")))
            .doFinally(signal -> session.endCycle())
            .subscribe(
                result -> deliver(session, callback,
                    seq -> PollUpdate.of(session.name(), result, clock.instant(), seq)),
                err -> {
                    log.warn("POLL_CYCLE_FAILED session={} reason={}", session.name(), err.getMessage());
                    deliver(session, callback,
                        seq -> PollUpdate.failure(session.name(), describe(err), clock.instant(), seq));
                });
    }

    private <T> void deliver(PollSession session, Consumer<PollUpdate<T>> callback,
                             LongFunction<PollUpdate<T>> update) {
        if (session.isStopped() && latePolicy == LateDeliveryPolicy.DROP) {
            log.debug("POLL_LATE_RESULT_DROPPED session={}", session.name());
            return;
        }

        PollUpdate<T> next = update.apply(session.nextSequence());
        try {
            callback.accept(next);
            log.debug("POLL_DELIVERED session={} seq={} source={} stale={} error={}",
                      session.name(), next.sequenceNumber(), next.source(), next.stale(), next.error());
        } catch (RuntimeException e) {
            log.error("POLL_CALLBACK_FAILED session={} seq={}", session.name(), next.sequenceNumber(), e);
        }
    }

    private static String describe(Throwable err) {
        return err.getMessage() != null ? err.getMessage() : err.getClass().getSimpleName();
    }
}
