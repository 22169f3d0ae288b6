package com.fieldops.sync.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DatasetTtlPolicyTest {

    private static final Instant STAMP = Instant.parse("2024-06-01T00:00:00Z");

    private final DatasetTtlPolicy policy = DatasetTtlPolicy.defaults();

    @Test
    @DisplayName("declared datasets carry their own TTL")
    void declaredTtls() {
        assertEquals(Duration.ofDays(365), policy.ttlFor("mainOld"));
        assertEquals(Duration.ofDays(30), policy.ttlFor("splitters"));
        assertEquals(Duration.ofMinutes(2), policy.ttlFor("fleetAssets"));
    }

    @Test
    @DisplayName("unknown dataset falls back to 24h")
    void unknownFallsBack() {
        assertEquals(Duration.ofHours(24), policy.ttlFor("outageAreas"));
        assertTrue(policy.isValid(STAMP, "outageAreas", STAMP.plus(Duration.ofHours(24)).minusMillis(1)));
        assertFalse(policy.isValid(STAMP, "outageAreas", STAMP.plus(Duration.ofHours(24))));
    }

    @Test
    @DisplayName("age equal to TTL is invalid for every declared dataset")
    void boundaryIsInvalid() {
        for (DatasetType<?> type : DatasetCatalog.all()) {
            Instant atTtl = STAMP.plus(policy.ttlFor(type.key()));
            assertFalse(policy.isValid(STAMP, type.key(), atTtl), type.key());
            assertTrue(policy.isValid(STAMP, type.key(), atTtl.minusMillis(1)), type.key());
        }
    }

    @Test
    @DisplayName("overrides and default replacement leave the original policy untouched")
    void overrides() {
        DatasetTtlPolicy tuned = policy
            .withDefaultTtl(Duration.ofHours(6))
            .withOverrides(Map.of("fleetAssets", Duration.ofSeconds(45)));

        assertEquals(Duration.ofSeconds(45), tuned.ttlFor("fleetAssets"));
        assertEquals(Duration.ofHours(6), tuned.ttlFor("outageAreas"));
        assertEquals(Duration.ofDays(90), tuned.ttlFor("fsa"));
        assertEquals(Duration.ofMinutes(2), policy.ttlFor("fleetAssets"));
    }

    @Test
    @DisplayName("missing stamp is never valid")
    void nullStamp() {
        assertFalse(policy.isValid(null, "fsa", STAMP));
    }
}
