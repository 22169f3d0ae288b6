package com.fieldops.sync.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Diagnostics row for one persisted entry.
 *
 * @param itemCount    result of the dataset's size function; 0 for undeclared datasets
 * @param payloadBytes length of the serialised payload
 */
public record CacheEntryStats(
    String datasetKey,
    Instant timestamp,
    Duration age,
    String ageDescription,
    int itemCount,
    long payloadBytes,
    Instant expiresAt,
    String expiryDescription,
    boolean expired
) {}
