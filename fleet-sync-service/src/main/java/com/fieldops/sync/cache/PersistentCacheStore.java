package com.fieldops.sync.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldops.common.exception.StorageFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

/**
 * Durable dataset cache backed by an embedded R2DBC database. One row per dataset
 * key; {@link #put} replaces the whole row and stamps it with the current time.
 *
 * <p><strong>Never the source of record.</strong> If the database cannot be opened
 * the failure is logged once at ERROR and every later call degrades to "no cached
 * value" (empty {@code Mono}, zero counts, empty stats). Failures of individual
 * statements are logged and treated the same way. No method of this class ever
 * emits an error signal.
 *
 * <p>Schema:
 * <pre>
 *   dataset_entries(entry_key PK, dataset_type, stamped_at epoch-millis, payload JSON)
 *   metadata(meta_key PK, meta_value)
 * </pre>
 */
public class PersistentCacheStore {

    private static final Logger log = LoggerFactory.getLogger(PersistentCacheStore.class);

    static final String COMPONENT = "PersistentCacheStore";

    public static final String META_SCHEMA_VERSION      = "schema_version";
    public static final String META_LAST_EXPIRED_SWEEP = "last_expired_sweep";
    public static final String META_LAST_CLEAR_ALL      = "last_clear_all";

    private static final String SCHEMA_VERSION = "1";

    private static final String CREATE_ENTRIES = """
        CREATE TABLE IF NOT EXISTS dataset_entries (
            entry_key    VARCHAR(128) PRIMARY KEY,
            dataset_type VARCHAR(128) NOT NULL,
            stamped_at   BIGINT       NOT NULL,
            payload      VARCHAR      NOT NULL
        )
        """;

    private static final String CREATE_METADATA = """
        CREATE TABLE IF NOT EXISTS metadata (
            meta_key   VARCHAR(128) PRIMARY KEY,
            meta_value VARCHAR(1024)
        )
        """;

    private static final String UPSERT_ENTRY = """
        MERGE INTO dataset_entries (entry_key, dataset_type, stamped_at, payload)
        KEY (entry_key)
        VALUES (:key, :datasetType, :stampedAt, :payload)
        """;

    /** Only the row the sweep saw; a newer {@code put} of the same key survives. */
    private static final String DELETE_IF_UNCHANGED =
        "DELETE FROM dataset_entries WHERE entry_key = :key AND stamped_at = :stampedAt";

    private static final String UPSERT_METADATA = """
        MERGE INTO metadata (meta_key, meta_value)
        KEY (meta_key)
        VALUES (:key, :value)
        """;

    private final DatabaseClient db;
    private final ObjectMapper objectMapper;
    private final DatasetTtlPolicy ttlPolicy;
    private final Clock clock;

    /** Schema initialisation runs once; its outcome is replayed to every later caller. */
    private final Mono<Boolean> opened;
    private volatile boolean available;

    public PersistentCacheStore(DatabaseClient db, ObjectMapper objectMapper,
                                DatasetTtlPolicy ttlPolicy, Clock clock) {
        this.db           = db;
        this.objectMapper = objectMapper;
        this.ttlPolicy    = ttlPolicy;
        this.clock        = clock;
        this.opened       = Mono.defer(this::initialize).cache();
    }

    /**
     * Opens the store, creating the schema when absent. Safe to call repeatedly;
     * completes with {@code false} when the store is unavailable.
     */
    public Mono<Boolean> open() {
        return opened;
    }

    public boolean isAvailable() {
        return available;
    }

    // ── reads ────────────────────────────────────────────────────────────────

    /**
     * Returns the stored entry regardless of its age, or empty when absent,
     * unreadable or the store is unavailable. Use {@link #isValid} to check freshness.
     */
    public <T> Mono<CacheEntry<T>> get(DatasetType<T> type) {
        return whenOpen("get", type.key(), () -> db.sql(
                "SELECT entry_key, stamped_at, payload FROM dataset_entries WHERE entry_key = :key")
            .bind("key", type.key())
            .map((row, meta) -> new StoredRow(
                row.get("entry_key", String.class),
                null,
                row.get("stamped_at", Long.class),
                row.get("payload", String.class)))
            .one()
            .map(stored -> new CacheEntry<>(stored.key(), read(stored.payload(), type),
                                            Instant.ofEpochMilli(stored.stampedAt())))
            .doOnNext(entry -> log.debug("CACHE_READ tier=persistent dataset={} age={}",
                                         type.key(), ageOf(entry.timestamp()))));
    }

    /** {@code true} iff the entry's age is strictly below its dataset's TTL. */
    public boolean isValid(CacheEntry<?> entry, DatasetType<?> type) {
        return entry != null && ttlPolicy.isValid(entry.timestamp(), type.key(), clock.instant());
    }

    // ── writes ───────────────────────────────────────────────────────────────

    /** Replaces the entry for {@code type} with {@code payload}, stamped now. */
    public <T> Mono<Void> put(DatasetType<T> type, T payload) {
        return whenOpen("put", type.key(), () -> {
            String json = write(payload);
            Instant now = clock.instant();
            return db.sql(UPSERT_ENTRY)
                .bind("key", type.key())
                .bind("datasetType", type.key())
                .bind("stampedAt", now.toEpochMilli())
                .bind("payload", json)
                .fetch()
                .rowsUpdated()
                .doOnNext(n -> log.info("CACHE_WRITE tier=persistent dataset={} items={} bytes={}",
                                        type.key(), type.sizeOf(payload), utf8Length(json)));
        }).then();
    }

    /**
     * Deletes every entry whose age has reached its TTL, logging each deletion.
     *
     * @return number of entries deleted
     */
    public Mono<Integer> clearExpired() {
        return whenOpen("clearExpired", "*", () -> {
            Instant now = clock.instant();
            return listRows(false)
                .collectList()
                .flatMapMany(Flux::fromIterable)
                .filter(row -> !ttlPolicy.isValid(Instant.ofEpochMilli(row.stampedAt()), row.datasetType(), now))
                .concatMap(row -> deleteIfUnchanged(row.key(), row.stampedAt())
                    .doOnNext(n -> {
                        if (n > 0) {
                            log.info("CACHE_EXPIRED_CLEARED dataset={} age={}", row.datasetType(),
                                     AgeFormatter.describe(ageOf(Instant.ofEpochMilli(row.stampedAt()))));
                        } else {
                            log.debug("CACHE_EXPIRED_SKIPPED dataset={} reason=rewritten since scan", row.datasetType());
                        }
                    })
                    .map(Long::intValue))
                .reduce(0, Integer::sum)
                .flatMap(count -> putMetadata(META_LAST_EXPIRED_SWEEP, now.toString()).thenReturn(count));
        }).defaultIfEmpty(0);
    }

    /** Deletes {@code key} only while it still carries {@code stampedAt}. */
    Mono<Long> deleteIfUnchanged(String key, long stampedAt) {
        return db.sql(DELETE_IF_UNCHANGED)
            .bind("key", key)
            .bind("stampedAt", stampedAt)
            .fetch()
            .rowsUpdated();
    }

    public Mono<Void> clearAll() {
        return whenOpen("clearAll", "*", () -> db.sql("DELETE FROM dataset_entries")
            .fetch()
            .rowsUpdated()
            .doOnNext(n -> log.info("CACHE_CLEARED_ALL entries={}", n))
            .flatMap(n -> putMetadata(META_LAST_CLEAR_ALL, clock.instant().toString()).thenReturn(n)))
            .then();
    }

    // ── diagnostics ──────────────────────────────────────────────────────────

    public Mono<List<CacheEntryStats>> stats() {
        return whenOpen("stats", "*", () -> {
            Instant now = clock.instant();
            return listRows(true)
                .map(row -> toStats(row, now))
                .collectList();
        }).defaultIfEmpty(List.of());
    }

    /** UTF-8 bytes of serialised payload currently held; 0 when unavailable. */
    public Mono<Long> usageBytes() {
        return whenOpen("usageBytes", "*", () -> db.sql(
                "SELECT COALESCE(SUM(OCTET_LENGTH(payload)), 0) AS used FROM dataset_entries")
            .map((row, meta) -> ((Number) row.get("used")).longValue())
            .one())
            .defaultIfEmpty(0L);
    }

    public Mono<String> metadata(String key) {
        return whenOpen("metadata", key, () -> db.sql("SELECT meta_value FROM metadata WHERE meta_key = :key")
            .bind("key", key)
            .map((row, meta) -> row.get("meta_value", String.class))
            .one());
    }

    // ── internals ────────────────────────────────────────────────────────────

    private Mono<Boolean> initialize() {
        return db.sql(CREATE_ENTRIES).then()
            .then(db.sql(CREATE_METADATA).then())
            .then(putMetadataUnchecked(META_SCHEMA_VERSION, SCHEMA_VERSION))
            .thenReturn(true)
            .doOnNext(ok -> {
                available = true;
                log.info("CACHE_STORE_OPENED schemaVersion={}", SCHEMA_VERSION);
            })
            .onErrorResume(e -> {
                log.error("CACHE_STORE_UNAVAILABLE running without persistent cache",
                          new StorageFailureException(COMPONENT, "failed to open persistent cache", e));
                return Mono.just(false);
            });
    }

    /**
     * Runs {@code op} only when the store opened successfully. Any failure of the
     * operation is logged and swallowed into an empty result.
     */
    private <R> Mono<R> whenOpen(String operation, String datasetKey, Supplier<Mono<R>> op) {
        return opened.flatMap(isOpen -> {
            if (!isOpen) {
                log.debug("CACHE_STORE_SKIPPED op={} dataset={} reason=unavailable", operation, datasetKey);
                return Mono.<R>empty();
            }
            return Mono.defer(op)
                .onErrorResume(e -> {
                    log.warn("CACHE_STORAGE_FAILURE op={} dataset={} reason={}", operation, datasetKey, e.getMessage(),
                             new StorageFailureException(COMPONENT, operation + " failed for " + datasetKey, e));
                    return Mono.empty();
                });
        });
    }

    private Flux<StoredRow> listRows(boolean withPayload) {
        String columns = withPayload
            ? "entry_key, dataset_type, stamped_at, payload"
            : "entry_key, dataset_type, stamped_at";
        return db.sql("SELECT " + columns + " FROM dataset_entries ORDER BY entry_key")
            .map((row, meta) -> new StoredRow(
                row.get("entry_key", String.class),
                row.get("dataset_type", String.class),
                row.get("stamped_at", Long.class),
                withPayload ? row.get("payload", String.class) : null))
            .all();
    }

    private Mono<Void> putMetadata(String key, String value) {
        return putMetadataUnchecked(key, value)
            .onErrorResume(e -> {
                log.warn("CACHE_METADATA_WRITE_FAILED key={} reason={}", key, e.getMessage());
                return Mono.empty();
            });
    }

    private Mono<Void> putMetadataUnchecked(String key, String value) {
        return db.sql(UPSERT_METADATA)
            .bind("key", key)
            .bind("value", value)
            .fetch()
            .rowsUpdated()
            .then();
    }

    private CacheEntryStats toStats(StoredRow row, Instant now) {
        Instant stampedAt = Instant.ofEpochMilli(row.stampedAt());
        Duration age      = Duration.between(stampedAt, now);
        Instant expiresAt = ttlPolicy.expiresAt(stampedAt, row.datasetType());
        Duration left     = Duration.between(now, expiresAt);
        return new CacheEntryStats(
            row.datasetType(),
            stampedAt,
            age,
            AgeFormatter.describe(age),
            itemCount(row),
            utf8Length(row.payload()),
            expiresAt,
            AgeFormatter.describeExpiry(left),
            !ttlPolicy.isValid(stampedAt, row.datasetType(), now));
    }

    private int itemCount(StoredRow row) {
        return DatasetCatalog.find(row.datasetType())
            .map(type -> countItems(type, row.payload()))
            .orElse(0);
    }

    private <T> int countItems(DatasetType<T> type, String json) {
        try {
            return type.sizeOf(objectMapper.readValue(json, type.payloadType()));
        } catch (JsonProcessingException e) {
            log.warn("CACHE_STATS_UNREADABLE dataset={} reason={}", type.key(), e.getOriginalMessage());
            return 0;
        }
    }

    private <T> T read(String json, DatasetType<T> type) {
        try {
            return objectMapper.readValue(json, type.payloadType());
        } catch (JsonProcessingException e) {
            throw new StorageFailureException(COMPONENT, "unreadable payload for " + type.key(), e);
        }
    }

    private String write(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new StorageFailureException(COMPONENT, "unserialisable payload", e);
        }
    }

    private Duration ageOf(Instant stampedAt) {
        return Duration.between(stampedAt, clock.instant());
    }

    private static long utf8Length(String json) {
        return json == null ? 0 : json.getBytes(StandardCharsets.UTF_8).length;
    }

    private record StoredRow(String key, String datasetType, Long stampedAt, String payload) {}
}
