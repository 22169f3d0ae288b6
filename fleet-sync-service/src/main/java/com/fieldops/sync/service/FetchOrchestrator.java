package com.fieldops.sync.service;

import com.fieldops.common.exception.FieldOpsException;
import com.fieldops.common.exception.NetworkFailureException;
import com.fieldops.common.model.FetchResult;
import com.fieldops.sync.cache.CacheEntry;
import com.fieldops.sync.cache.DatasetType;
import com.fieldops.sync.cache.MemoryCache;
import com.fieldops.sync.cache.PersistentCacheStore;
import com.fieldops.sync.client.FailureClassifier;
import com.fieldops.sync.flight.SingleFlightCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * "Get current data" for any declared dataset, composed over both cache tiers and a
 * remote fetch.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Valid persistent entry → return it, {@code source=CACHE}.</li>
 *   <li>Fresh memory entry → return it, {@code source=CACHE}.</li>
 *   <li>Otherwise fetch through the {@link SingleFlightCoordinator} (one fetch per
 *       dataset at a time), write both tiers, return {@code source=NETWORK}.</li>
 *   <li>On any failure: the newest memory entry, else the persistent entry, regardless
 *       of age, as {@code stale=true} with the failure message; with nothing cached,
 *       the dataset's empty payload.</li>
 * </ol>
 *
 * <p>The returned {@code Mono} always emits exactly one well-formed {@link FetchResult};
 * it never errors.
 */
public class FetchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(FetchOrchestrator.class);

    static final String COMPONENT = "FetchOrchestrator";

    private final PersistentCacheStore store;
    private final MemoryCache memory;
    private final SingleFlightCoordinator flights;
    private final Clock clock;

    public FetchOrchestrator(PersistentCacheStore store, MemoryCache memory,
                             SingleFlightCoordinator flights, Clock clock) {
        this.store   = store;
        this.memory  = memory;
        this.flights = flights;
        this.clock   = clock;
    }

    /**
     * @param fetcher remote fetch for {@code type}; subscribed at most once per flight
     */
    public <T> Mono<FetchResult<T>> current(DatasetType<T> type, Supplier<Mono<T>> fetcher) {
        return store.get(type)
            .filter(entry -> store.isValid(entry, type))
            .map(entry -> {
                log.info("CACHE_HIT tier=persistent dataset={} stampedAt={}", type.key(), entry.timestamp());
                return FetchResult.cached(entry.payload(), entry.timestamp());
            })
            .switchIfEmpty(Mono.defer(() -> fromMemoryOrNetwork(type, fetcher)))
            .onErrorResume(e -> {
                // fallback itself failed; still hand back a well-formed result
                log.error("FETCH_UNEXPECTED_FAILURE dataset={}", type.key(), e);
                return Mono.just(FetchResult.empty(type.empty(), clock.instant(), e.getMessage()));
            });
    }

    /** Drops the memory tier. The persistent tier is managed by its own store. */
    public void clearMemory() {
        memory.clear();
    }

    // ── private ───────────────────────────────────────────────────────────────

    private <T> Mono<FetchResult<T>> fromMemoryOrNetwork(DatasetType<T> type, Supplier<Mono<T>> fetcher) {
        CacheEntry<T> recent = memory.get(type);
        if (memory.isFresh(recent)) {
            log.info("CACHE_HIT tier=memory dataset={} stampedAt={}", type.key(), recent.timestamp());
            return Mono.just(FetchResult.cached(recent.payload(), recent.timestamp()));
        }

        log.info("CACHE_MISS dataset={}", type.key());
        return flights.execute(type.key(), () -> fetchAndStore(type, fetcher))
            .onErrorResume(e -> fallback(type, FailureClassifier.classify(COMPONENT, e)));
    }

    private <T> Mono<FetchResult<T>> fetchAndStore(DatasetType<T> type, Supplier<Mono<T>> fetcher) {
        return Mono.defer(fetcher)
            .switchIfEmpty(Mono.error(() ->
                new NetworkFailureException(COMPONENT, "remote returned no data for " + type.key())))
            .flatMap(payload -> {
                Instant fetchedAt = memory.put(type, payload).timestamp();
                log.info("FETCH_SUCCESS dataset={} items={}", type.key(), type.sizeOf(payload));
                return store.put(type, payload)
                    .thenReturn(FetchResult.network(payload, fetchedAt));
            });
    }

    private <T> Mono<FetchResult<T>> fallback(DatasetType<T> type, FieldOpsException failure) {
        String error = failure.getMessage();
        CacheEntry<T> recent = memory.get(type);
        if (recent != null) {
            log.warn("FETCH_FALLBACK tier=memory dataset={} kind={} stampedAt={}",
                     type.key(), failure.getKind(), recent.timestamp());
            return Mono.just(FetchResult.stale(recent.payload(), recent.timestamp(), error));
        }

        return store.get(type)
            .map(entry -> {
                log.warn("FETCH_FALLBACK tier=persistent dataset={} kind={} stampedAt={}",
                         type.key(), failure.getKind(), entry.timestamp());
                return FetchResult.stale(entry.payload(), entry.timestamp(), error);
            })
            .switchIfEmpty(Mono.fromSupplier(() -> {
                log.warn("FETCH_FALLBACK tier=none dataset={} kind={} reason={}",
                         type.key(), failure.getKind(), error);
                return FetchResult.empty(type.empty(), clock.instant(), error);
            }));
    }
}
