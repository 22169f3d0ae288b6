package com.fieldops.sync.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-lifetime cache in front of the persistent store, one entry per dataset.
 *
 * <p><strong>Fetch Once → Serve Many:</strong> a short TTL (tens of seconds) absorbs
 * bursts of near-simultaneous requests without touching storage or the network.
 * Entries are never evicted on read: an expired entry is still the most recent
 * value known and is what the fetch layer falls back to when the remote fails.
 *
 * <p>Thread-safe via {@link ConcurrentHashMap}. No blocking calls.
 */
public class MemoryCache {

    private static final Logger log = LoggerFactory.getLogger(MemoryCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(30);

    private final ConcurrentHashMap<String, CacheEntry<?>> store = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public MemoryCache(Duration ttl, Clock clock) {
        this.ttl   = ttl;
        this.clock = clock;
    }

    /**
     * Returns the latest entry for the dataset regardless of age, or {@code null} if
     * nothing was ever stored.
     */
    @SuppressWarnings("unchecked")
    public <T> CacheEntry<T> get(DatasetType<T> type) {
        return (CacheEntry<T>) store.get(type.key());
    }

    /** Stores {@code payload} for the dataset, stamped now, replacing any previous entry. */
    public <T> CacheEntry<T> put(DatasetType<T> type, T payload) {
        CacheEntry<T> entry = new CacheEntry<>(type.key(), payload, clock.instant());
        store.put(type.key(), entry);
        log.info("CACHE_WRITE tier=memory dataset={} items={} ttlSeconds={}",
                 type.key(), type.sizeOf(payload), ttl.toSeconds());
        return entry;
    }

    /** {@code true} while the entry is younger than the memory TTL (strict). */
    public boolean isFresh(CacheEntry<?> entry) {
        if (entry == null) {
            return false;
        }
        Instant now = clock.instant();
        return Duration.between(entry.timestamp(), now).compareTo(ttl) < 0;
    }

    public void clear() {
        store.clear();
        log.info("CACHE_CLEARED_ALL tier=memory");
    }

    public int size() {
        return store.size();
    }

    public Duration ttl() {
        return ttl;
    }
}
