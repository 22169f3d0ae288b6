package com.fieldops.sync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fieldops.sync.cache.DatasetTtlPolicy;
import com.fieldops.sync.cache.MemoryCache;
import com.fieldops.sync.cache.PersistentCacheStore;
import com.fieldops.sync.client.TelematicsClient;
import com.fieldops.sync.client.TelematicsTransport;
import com.fieldops.sync.flight.SingleFlightCoordinator;
import com.fieldops.sync.polling.LateDeliveryPolicy;
import com.fieldops.sync.polling.PollingDistributor;
import com.fieldops.sync.quota.PersistentStoreEstimator;
import com.fieldops.sync.quota.StorageQuotaMonitor;
import com.fieldops.sync.service.AssetRecordAssembler;
import com.fieldops.sync.service.FetchOrchestrator;
import com.fieldops.sync.service.FleetDataService;
import io.r2dbc.spi.ConnectionFactories;
import io.r2dbc.spi.ConnectionFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wires the sync layer. Every component is constructed once here and receives its
 * collaborators explicitly; none of them reads configuration on its own.
 */
@Configuration
public class SyncConfig {

    // ── telematics ───────────────────────────────────────────────────────────

    @Value("${telematics.enabled:false}")
    private boolean telematicsEnabled;

    @Value("${telematics.mock-mode:false}")
    private boolean mockMode;

    @Value("${telematics.base-url:https://my.geotab.com}")
    private String baseUrl;

    @Value("${telematics.database:}")
    private String database;

    @Value("${telematics.username:}")
    private String username;

    @Value("${telematics.password:}")
    private String password;

    @Value("${telematics.refresh-interval:30s}")
    private Duration refreshInterval;

    @Value("${telematics.call-timeout:30s}")
    private Duration callTimeout;

    @Value("${telematics.max-retries:3}")
    private int maxRetries;

    @Value("${telematics.retry-base-delay:5s}")
    private Duration retryBaseDelay;

    @Value("${telematics.rate-limit-window:60s}")
    private Duration rateLimitWindow;

    // ── cache / quota / polling ──────────────────────────────────────────────

    @Value("${fieldops.cache.r2dbc-url:r2dbc:h2:file//${user.home}/.fieldops/cache}")
    private String r2dbcUrl;

    @Value("${fieldops.cache.memory-ttl:30s}")
    private Duration memoryTtl;

    @Value("${fieldops.cache.default-ttl:24h}")
    private Duration defaultTtl;

    /** Dataset key → TTL in seconds, e.g. {@code {fleetAssets: 60}}. */
    @Value("#{${fieldops.cache.ttl-overrides:{:}}}")
    private Map<String, Long> ttlOverrideSeconds;

    @Value("${fieldops.cache.capacity-bytes:52428800}")
    private long capacityBytes;

    @Value("${fieldops.polling.late-delivery:DELIVER}")
    private LateDeliveryPolicy lateDeliveryPolicy;

    @Bean
    public TelematicsSettings telematicsSettings() {
        return new TelematicsSettings(telematicsEnabled, mockMode, baseUrl, database, username, password,
            refreshInterval, callTimeout, maxRetries, retryBaseDelay, rateLimitWindow);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Scheduler syncScheduler() {
        return Schedulers.parallel();
    }

    // ── cache tiers ──────────────────────────────────────────────────────────

    @Bean
    public ConnectionFactory cacheConnectionFactory() {
        return ConnectionFactories.get(r2dbcUrl);
    }

    @Bean
    public DatabaseClient cacheDatabaseClient(ConnectionFactory cacheConnectionFactory) {
        return DatabaseClient.create(cacheConnectionFactory);
    }

    @Bean
    public DatasetTtlPolicy datasetTtlPolicy() {
        Map<String, Duration> overrides = new LinkedHashMap<>();
        ttlOverrideSeconds.forEach((key, seconds) -> overrides.put(key, Duration.ofSeconds(seconds)));
        return DatasetTtlPolicy.defaults()
            .withDefaultTtl(defaultTtl)
            .withOverrides(overrides);
    }

    @Bean
    public PersistentCacheStore persistentCacheStore(DatabaseClient cacheDatabaseClient, ObjectMapper objectMapper,
                                                     DatasetTtlPolicy datasetTtlPolicy, Clock clock) {
        return new PersistentCacheStore(cacheDatabaseClient, objectMapper, datasetTtlPolicy, clock);
    }

    @Bean
    public MemoryCache memoryCache(Clock clock) {
        return new MemoryCache(memoryTtl, clock);
    }

    @Bean
    public StorageQuotaMonitor storageQuotaMonitor(PersistentCacheStore store, Scheduler syncScheduler) {
        return new StorageQuotaMonitor(store, new PersistentStoreEstimator(store, capacityBytes), syncScheduler);
    }

    // ── fetch path ───────────────────────────────────────────────────────────

    @Bean
    public SingleFlightCoordinator singleFlightCoordinator() {
        return new SingleFlightCoordinator();
    }

    @Bean
    public TelematicsClient telematicsClient(TelematicsSettings settings, TelematicsTransport transport,
                                             SingleFlightCoordinator flights, ObjectMapper objectMapper,
                                             Clock clock, Scheduler syncScheduler) {
        return new TelematicsClient(settings, transport, flights, objectMapper, clock, syncScheduler);
    }

    @Bean
    public FetchOrchestrator fetchOrchestrator(PersistentCacheStore store, MemoryCache memory,
                                               SingleFlightCoordinator flights, Clock clock) {
        return new FetchOrchestrator(store, memory, flights, clock);
    }

    @Bean
    public FleetDataService fleetDataService(TelematicsClient client, FetchOrchestrator orchestrator, Clock clock) {
        return new FleetDataService(client, orchestrator, new AssetRecordAssembler(clock));
    }

    @Bean
    public PollingDistributor pollingDistributor(Scheduler syncScheduler, Clock clock) {
        return new PollingDistributor(syncScheduler, clock, lateDeliveryPolicy);
    }
}
