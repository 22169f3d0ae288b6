package com.fieldops.sync.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Maximum age per dataset. Immutable; built once at startup.
 *
 * <p>Unknown datasets fall back to {@link #DEFAULT_TTL}. An entry is valid only while
 * its age is strictly below the TTL, so an entry exactly {@code ttl} old is expired.
 */
public final class DatasetTtlPolicy {

    public static final Duration DEFAULT_TTL = Duration.ofHours(24);

    private static final Map<String, Duration> PLANT_AND_FLEET_TTLS = Map.of(
        "fsa",          Duration.ofDays(90),
        "mainFiber",    Duration.ofDays(90),
        "mainOld",      Duration.ofDays(365),
        "mstFiber",     Duration.ofDays(90),
        "mstTerminals", Duration.ofDays(30),
        "closures",     Duration.ofDays(30),
        "splitters",    Duration.ofDays(30),
        "nodeSites",    Duration.ofDays(90),
        "fleetAssets",  Duration.ofMinutes(2)
    );

    private final Map<String, Duration> ttlByDataset;
    private final Duration defaultTtl;

    public DatasetTtlPolicy(Map<String, Duration> ttlByDataset, Duration defaultTtl) {
        this.ttlByDataset = Map.copyOf(ttlByDataset);
        this.defaultTtl   = defaultTtl;
    }

    public static DatasetTtlPolicy defaults() {
        return new DatasetTtlPolicy(PLANT_AND_FLEET_TTLS, DEFAULT_TTL);
    }

    /** Returns a new policy with {@code overrides} layered over this one. */
    public DatasetTtlPolicy withOverrides(Map<String, Duration> overrides) {
        Map<String, Duration> merged = new HashMap<>(ttlByDataset);
        merged.putAll(overrides);
        return new DatasetTtlPolicy(merged, defaultTtl);
    }

    /** Returns a new policy with a different fallback for unknown datasets. */
    public DatasetTtlPolicy withDefaultTtl(Duration fallback) {
        return new DatasetTtlPolicy(ttlByDataset, fallback);
    }

    public Duration ttlFor(String datasetKey) {
        return ttlByDataset.getOrDefault(datasetKey, defaultTtl);
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    public boolean isValid(Instant stampedAt, String datasetKey, Instant now) {
        if (stampedAt == null) {
            return false;
        }
        Duration age = Duration.between(stampedAt, now);
        return age.compareTo(ttlFor(datasetKey)) < 0;
    }

    public Instant expiresAt(Instant stampedAt, String datasetKey) {
        return stampedAt.plus(ttlFor(datasetKey));
    }
}
