package com.fieldops.sync.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldops.common.model.AssetCategory;
import com.fieldops.common.model.AssetRecord;
import com.fieldops.common.model.CommunicationStatus;
import com.fieldops.common.model.FleetSnapshot;
import com.fieldops.sync.model.FeatureCollection;
import com.fieldops.sync.support.SchedulerClock;
import com.fieldops.sync.support.TestStores;
import io.r2dbc.spi.Connection;
import io.r2dbc.spi.ConnectionFactory;
import io.r2dbc.spi.ConnectionFactoryMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.reactivestreams.Publisher;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Mono;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verification of {@link PersistentCacheStore} against an in-memory H2 database.
 * Time is virtual: {@code advanceTimeBy} ages every stored entry.
 */
class PersistentCacheStoreTest {

    private VirtualTimeScheduler time;
    private SchedulerClock clock;
    private PersistentCacheStore store;

    @BeforeEach
    void setUp() {
        time  = VirtualTimeScheduler.create();
        clock = new SchedulerClock(time);
        store = TestStores.openStore(clock);
    }

    private static FleetSnapshot twoTrucks() {
        Instant seen = SchedulerClock.ORIGIN;
        return new FleetSnapshot(List.of(
            new AssetRecord("fiber-001", "Fiber Truck 1", 33.5186, -86.8104, 35, 45.0, seen,
                            CommunicationStatus.ONLINE, AssetCategory.FIBER, "John Smith", true),
            new AssetRecord("electric-001", "Electric Truck 1", 34.7304, -86.5861, 0, 90.0, seen,
                            CommunicationStatus.OFFLINE, AssetCategory.ELECTRIC, "Mike Wilson", false)));
    }

    private static FeatureCollection features(int count) {
        ObjectMapper mapper = TestStores.objectMapper();
        List<JsonNode> list = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            list.add(mapper.createObjectNode().put("type", "Feature").put("id", i));
        }
        return new FeatureCollection("FeatureCollection", list);
    }

    // ── get / put ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("get() / put()")
    class ReadWriteTests {

        @Test
        @DisplayName("put then get before TTL returns the same payload, valid")
        void roundTrip() {
            FleetSnapshot snapshot = twoTrucks();
            store.put(DatasetCatalog.FLEET_ASSETS, snapshot).block();

            CacheEntry<FleetSnapshot> entry = store.get(DatasetCatalog.FLEET_ASSETS).block();

            assertNotNull(entry);
            assertEquals(snapshot, entry.payload());
            assertEquals(SchedulerClock.ORIGIN, entry.timestamp());
            assertTrue(store.isValid(entry, DatasetCatalog.FLEET_ASSETS));
        }

        @Test
        @DisplayName("absent dataset → empty")
        void absent() {
            assertNull(store.get(DatasetCatalog.SPLITTERS).block());
        }

        @Test
        @DisplayName("put fully replaces the previous entry and restamps it")
        void putReplaces() {
            store.put(DatasetCatalog.CLOSURES, features(5)).block();
            time.advanceTimeBy(Duration.ofHours(1));
            store.put(DatasetCatalog.CLOSURES, features(2)).block();

            CacheEntry<FeatureCollection> entry = store.get(DatasetCatalog.CLOSURES).block();

            assertNotNull(entry);
            assertEquals(2, entry.payload().size());
            assertEquals(SchedulerClock.ORIGIN.plus(Duration.ofHours(1)), entry.timestamp());
        }

        @Test
        @DisplayName("get returns an entry past its TTL, marked invalid")
        void expiredStillReadable() {
            store.put(DatasetCatalog.FLEET_ASSETS, twoTrucks()).block();
            time.advanceTimeBy(Duration.ofMinutes(10));

            CacheEntry<FleetSnapshot> entry = store.get(DatasetCatalog.FLEET_ASSETS).block();

            assertNotNull(entry);
            assertFalse(store.isValid(entry, DatasetCatalog.FLEET_ASSETS));
        }
    }

    // ── isValid ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("isValid(): strict TTL boundary")
    class ValidityTests {

        @Test
        @DisplayName("age one millisecond below TTL → valid")
        void justBelowTtl() {
            store.put(DatasetCatalog.FLEET_ASSETS, twoTrucks()).block();
            CacheEntry<FleetSnapshot> entry = store.get(DatasetCatalog.FLEET_ASSETS).block();

            time.advanceTimeBy(Duration.ofMinutes(2).minusMillis(1));
            assertTrue(store.isValid(entry, DatasetCatalog.FLEET_ASSETS));
        }

        @Test
        @DisplayName("age exactly TTL → invalid")
        void exactlyTtl() {
            store.put(DatasetCatalog.FLEET_ASSETS, twoTrucks()).block();
            CacheEntry<FleetSnapshot> entry = store.get(DatasetCatalog.FLEET_ASSETS).block();

            time.advanceTimeBy(Duration.ofMinutes(2));
            assertFalse(store.isValid(entry, DatasetCatalog.FLEET_ASSETS));
        }

        @Test
        @DisplayName("null entry → invalid")
        void nullEntry() {
            assertFalse(store.isValid(null, DatasetCatalog.FSA));
        }
    }

    // ── clearExpired / clearAll ──────────────────────────────────────────────

    @Nested
    @DisplayName("clearExpired() / clearAll()")
    class EvictionTests {

        @Test
        @DisplayName("deletes only expired entries and records the sweep")
        void deletesExpiredOnly() {
            store.put(DatasetCatalog.FLEET_ASSETS, twoTrucks()).block();   // 2 min TTL
            store.put(DatasetCatalog.MST_TERMINALS, features(3)).block();   // 30 day TTL
            time.advanceTimeBy(Duration.ofHours(1));

            assertEquals(1, store.clearExpired().block());

            assertNull(store.get(DatasetCatalog.FLEET_ASSETS).block());
            assertNotNull(store.get(DatasetCatalog.MST_TERMINALS).block());
            assertNotNull(store.metadata(PersistentCacheStore.META_LAST_EXPIRED_SWEEP).block());
        }

        @Test
        @DisplayName("a second sweep with no intervening writes deletes nothing")
        void idempotent() {
            store.put(DatasetCatalog.FLEET_ASSETS, twoTrucks()).block();
            store.put(DatasetCatalog.SPLITTERS, features(1)).block();
            time.advanceTimeBy(Duration.ofDays(31));

            assertEquals(2, store.clearExpired().block());
            assertEquals(0, store.clearExpired().block());
        }

        @Test
        @DisplayName("an entry rewritten after the sweep scanned it is not deleted")
        void rewriteDuringSweepSurvives() {
            store.put(DatasetCatalog.FLEET_ASSETS, twoTrucks()).block();
            long scannedStamp = store.get(DatasetCatalog.FLEET_ASSETS).block().timestamp().toEpochMilli();
            time.advanceTimeBy(Duration.ofHours(1));
            store.put(DatasetCatalog.FLEET_ASSETS, twoTrucks()).block();

            assertEquals(0L, store.deleteIfUnchanged(DatasetCatalog.FLEET_ASSETS.key(), scannedStamp).block());

            CacheEntry<FleetSnapshot> entry = store.get(DatasetCatalog.FLEET_ASSETS).block();
            assertNotNull(entry);
            assertEquals(SchedulerClock.ORIGIN.plus(Duration.ofHours(1)), entry.timestamp());
            assertTrue(store.isValid(entry, DatasetCatalog.FLEET_ASSETS));
            assertEquals(0, store.clearExpired().block());
        }

        @Test
        @DisplayName("an unchanged expired entry is deleted by its scanned stamp")
        void unchangedDeleted() {
            store.put(DatasetCatalog.FLEET_ASSETS, twoTrucks()).block();
            long scannedStamp = store.get(DatasetCatalog.FLEET_ASSETS).block().timestamp().toEpochMilli();
            time.advanceTimeBy(Duration.ofHours(1));

            assertEquals(1L, store.deleteIfUnchanged(DatasetCatalog.FLEET_ASSETS.key(), scannedStamp).block());
            assertNull(store.get(DatasetCatalog.FLEET_ASSETS).block());
        }

        @Test
        @DisplayName("clearAll empties the store and records it")
        void clearAll() {
            store.put(DatasetCatalog.FSA, features(4)).block();
            store.put(DatasetCatalog.NODE_SITES, features(4)).block();

            store.clearAll().block();

            assertEquals(List.of(), store.stats().block());
            assertEquals(0L, store.usageBytes().block());
            assertNotNull(store.metadata(PersistentCacheStore.META_LAST_CLEAR_ALL).block());
        }
    }

    // ── stats ────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("stats()")
    class StatsTests {

        @Test
        @DisplayName("reports age, item count, bytes and expiry per entry")
        void perEntryStats() {
            store.put(DatasetCatalog.MAIN_FIBER, features(7)).block();
            time.advanceTimeBy(Duration.ofHours(3));

            List<CacheEntryStats> stats = store.stats().block();

            assertNotNull(stats);
            assertEquals(1, stats.size());
            CacheEntryStats row = stats.get(0);
            assertEquals("mainFiber", row.datasetKey());
            assertEquals(Duration.ofHours(3), row.age());
            assertEquals("3 hours", row.ageDescription());
            assertEquals(7, row.itemCount());
            assertTrue(row.payloadBytes() > 0);
            assertEquals(SchedulerClock.ORIGIN.plus(Duration.ofDays(90)), row.expiresAt());
            assertTrue(row.expiryDescription().startsWith("Expires in "));
            assertFalse(row.expired());
        }

        @Test
        @DisplayName("expired entry reads 'Expired'")
        void expiredRow() {
            store.put(DatasetCatalog.FLEET_ASSETS, twoTrucks()).block();
            time.advanceTimeBy(Duration.ofMinutes(5));

            CacheEntryStats row = store.stats().block().get(0);

            assertEquals(2, row.itemCount());
            assertEquals("Expired", row.expiryDescription());
            assertTrue(row.expired());
        }

        @Test
        @DisplayName("usage grows with stored payload")
        void usageBytes() {
            assertEquals(0L, store.usageBytes().block());
            store.put(DatasetCatalog.FSA, features(20)).block();
            assertTrue(store.usageBytes().block() > 0);
        }

        @Test
        @DisplayName("usage counts UTF-8 bytes, matching per-entry payload bytes")
        void usageCountsBytesNotCharacters() {
            ObjectMapper mapper = TestStores.objectMapper();
            List<JsonNode> named = List.of(
                mapper.createObjectNode().put("type", "Feature").put("name", "Café Ñandú"),
                mapper.createObjectNode().put("type", "Feature").put("name", "Bahía Señal Ø"));
            store.put(DatasetCatalog.NODE_SITES, new FeatureCollection("FeatureCollection", named)).block();
            store.put(DatasetCatalog.FSA, features(3)).block();

            long perEntry = store.stats().block().stream().mapToLong(CacheEntryStats::payloadBytes).sum();

            assertEquals(perEntry, store.usageBytes().block());
        }

        @Test
        @DisplayName("schema version is recorded on open")
        void schemaVersion() {
            assertEquals("1", store.metadata(PersistentCacheStore.META_SCHEMA_VERSION).block());
        }
    }

    // ── unavailable store ────────────────────────────────────────────────────

    @Nested
    @DisplayName("unavailable store degrades, never throws")
    class UnavailableTests {

        private PersistentCacheStore broken;

        @BeforeEach
        void openBroken() {
            ConnectionFactory unreachable = new ConnectionFactory() {
                @Override
                public Publisher<? extends Connection> create() {
                    return Mono.error(new IllegalStateException("storage medium unavailable"));
                }

                @Override
                public ConnectionFactoryMetadata getMetadata() {
                    return () -> "H2";
                }
            };
            broken = new PersistentCacheStore(DatabaseClient.create(unreachable), TestStores.objectMapper(),
                                              new DatasetTtlPolicy(Map.of(), DatasetTtlPolicy.DEFAULT_TTL), clock);
        }

        @Test
        @DisplayName("open reports false and every operation returns its empty value")
        void degrades() {
            assertFalse(broken.open().block());
            assertFalse(broken.isAvailable());

            assertDoesNotThrow(() -> broken.put(DatasetCatalog.FSA, features(1)).block());
            assertNull(broken.get(DatasetCatalog.FSA).block());
            assertEquals(0, broken.clearExpired().block());
            assertDoesNotThrow(() -> broken.clearAll().block());
            assertEquals(List.of(), broken.stats().block());
            assertEquals(0L, broken.usageBytes().block());
        }
    }
}
