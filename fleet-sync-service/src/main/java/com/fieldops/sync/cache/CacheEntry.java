package com.fieldops.sync.cache;

import java.time.Instant;

/**
 * Immutable cached payload with the instant it was stored. Used by both tiers;
 * a {@code put} always replaces the whole entry.
 */
public record CacheEntry<T>(
    String key,
    T payload,
    Instant timestamp
) {}
