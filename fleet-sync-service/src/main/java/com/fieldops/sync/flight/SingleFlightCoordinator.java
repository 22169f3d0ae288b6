package com.fieldops.sync.flight;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Deduplicates concurrent units of work by key: while one is pending, later callers
 * for the same key share its result instead of starting another.
 *
 * <p>The shared result is a {@link Sinks.One}, so every waiter observes the single
 * resolution in the order it subscribed. The pending slot is removed <em>before</em>
 * the result is emitted; a call arriving after resolution always starts fresh work
 * rather than re-joining a resolved slot.
 *
 * <p>The unit of work is subscribed independently of its callers. Cancelling one
 * waiter does not cancel the work for the others.
 */
public class SingleFlightCoordinator {

    private static final Logger log = LoggerFactory.getLogger(SingleFlightCoordinator.class);

    private final ConcurrentHashMap<String, Mono<?>> pending = new ConcurrentHashMap<>();

    /**
     * Runs {@code work} for {@code key} unless a unit for that key is already pending,
     * in which case the caller joins it. Nothing happens until the returned
     * {@code Mono} is subscribed.
     */
    public <T> Mono<T> execute(String key, Supplier<Mono<T>> work) {
        return Mono.defer(() -> {
            Sinks.One<T> sink = Sinks.one();
            Mono<T> shared = sink.asMono();

            @SuppressWarnings("unchecked")
            Mono<T> existing = (Mono<T>) pending.putIfAbsent(key, shared);
            if (existing != null) {
                log.debug("FLIGHT_JOINED key={}", key);
                return existing;
            }

            log.debug("FLIGHT_STARTED key={}", key);
            start(key, shared, sink, work);
            return shared;
        });
    }

    public boolean isPending(String key) {
        return pending.containsKey(key);
    }

    public int pendingCount() {
        return pending.size();
    }

    public Set<String> pendingKeys() {
        return Set.copyOf(pending.keySet());
    }

    private <T> void start(String key, Mono<T> shared, Sinks.One<T> sink, Supplier<Mono<T>> work) {
        Mono<T> unit;
        try {
            unit = work.get();
        } catch (RuntimeException e) {
            unit = Mono.error(e);
        }

        unit.subscribe(
            value -> {
                pending.remove(key, shared);
                emit(key, sink.tryEmitValue(value));
            },
            error -> {
                pending.remove(key, shared);
                log.debug("FLIGHT_FAILED key={} reason={}", key, error.getMessage());
                emit(key, sink.tryEmitError(error));
            },
            () -> {
                // only reached without a value when the unit completed empty
                if (pending.remove(key, shared)) {
                    emit(key, sink.tryEmitEmpty());
                }
            });
    }

    private static void emit(String key, Sinks.EmitResult result) {
        if (result.isFailure()) {
            log.warn("FLIGHT_EMIT_FAILED key={} result={}", key, result);
        }
    }
}
