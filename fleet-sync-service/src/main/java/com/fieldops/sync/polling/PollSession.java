package com.fieldops.sync.polling;

import reactor.core.Disposable;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One named, independently stoppable fetch-and-deliver loop. The ticker subscription
 * is its cancellation token.
 */
public final class PollSession {

    private final String name;
    private final Duration interval;

    private final AtomicLong    sequence      = new AtomicLong();
    private final AtomicLong    skippedCycles = new AtomicLong();
    private final AtomicBoolean cycleInFlight = new AtomicBoolean();
    private final AtomicBoolean stopped       = new AtomicBoolean();

    private volatile Disposable ticker;

    PollSession(String name, Duration interval) {
        this.name     = name;
        this.interval = interval;
    }

    public String name() {
        return name;
    }

    public Duration interval() {
        return interval;
    }

    public boolean isStopped() {
        return stopped.get();
    }

    /** Deliveries so far. Sequence numbers are 1-based, so this is also the last one issued. */
    public long deliveredCount() {
        return sequence.get();
    }

    public long skippedCycles() {
        return skippedCycles.get();
    }

    public PollSessionStatus snapshot() {
        return new PollSessionStatus(name, interval, sequence.get(), skippedCycles.get());
    }

    void attach(Disposable ticker) {
        this.ticker = ticker;
    }

    long nextSequence() {
        return sequence.incrementAndGet();
    }

    /** @return {@code false} if a cycle is already running; the tick is counted as skipped */
    boolean beginCycle() {
        if (cycleInFlight.compareAndSet(false, true)) {
            return true;
        }
        skippedCycles.incrementAndGet();
        return false;
    }

    void endCycle() {
        cycleInFlight.set(false);
    }

    /** @return {@code true} only for the call that actually stopped the session */
    boolean stop() {
        if (!stopped.compareAndSet(false, true)) {
            return false;
        }
        Disposable current = ticker;
        if (current != null) {
            current.dispose();
        }
        return true;
    }
}
