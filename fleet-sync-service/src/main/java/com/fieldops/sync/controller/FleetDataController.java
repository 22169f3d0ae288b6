package com.fieldops.sync.controller;

import com.fieldops.common.model.FetchResult;
import com.fieldops.common.model.FleetSnapshot;
import com.fieldops.common.model.PollUpdate;
import com.fieldops.sync.cache.CacheEntryStats;
import com.fieldops.sync.cache.MemoryCache;
import com.fieldops.sync.cache.PersistentCacheStore;
import com.fieldops.sync.client.ClientStatus;
import com.fieldops.sync.client.ConnectionTestResult;
import com.fieldops.sync.client.TelematicsClient;
import com.fieldops.sync.config.TelematicsSettings;
import com.fieldops.sync.flight.SingleFlightCoordinator;
import com.fieldops.sync.polling.PollingDistributor;
import com.fieldops.sync.quota.QuotaReport;
import com.fieldops.sync.quota.StorageQuotaMonitor;
import com.fieldops.sync.service.FleetDataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/fleet")
public class FleetDataController {

    private static final Logger log = LoggerFactory.getLogger(FleetDataController.class);

    private final FleetDataService fleetService;
    private final TelematicsClient client;
    private final PersistentCacheStore store;
    private final MemoryCache memory;
    private final StorageQuotaMonitor quotaMonitor;
    private final PollingDistributor distributor;
    private final SingleFlightCoordinator flights;
    private final TelematicsSettings settings;

    public FleetDataController(FleetDataService fleetService, TelematicsClient client,
                               PersistentCacheStore store, MemoryCache memory,
                               StorageQuotaMonitor quotaMonitor, PollingDistributor distributor,
                               SingleFlightCoordinator flights, TelematicsSettings settings) {
        this.fleetService = fleetService;
        this.client       = client;
        this.store        = store;
        this.memory       = memory;
        this.quotaMonitor = quotaMonitor;
        this.distributor  = distributor;
        this.flights      = flights;
        this.settings     = settings;
    }

    @GetMapping("/assets")
    public Mono<FetchResult<FleetSnapshot>> assets() {
        return fleetService.currentFleet();
    }

    /** One poll session per connected subscriber; it ends when the subscriber goes away. */
    @GetMapping(value = "/assets/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<PollUpdate<FleetSnapshot>>> stream() {
        return Flux.<PollUpdate<FleetSnapshot>>create(sink -> {
                String session = "fleet-stream-" + UUID.randomUUID();
                log.info("SSE stream client connected. session={}", session);
                distributor.start(session, fleetService::currentFleet, sink::next, settings.refreshInterval());
                sink.onDispose(() -> {
                    log.info("SSE stream client disconnected. session={}", session);
                    distributor.stop(session);
                });
            })
            .map(update -> ServerSentEvent.<PollUpdate<FleetSnapshot>>builder()
                .id(String.valueOf(update.sequenceNumber()))
                .event(update.isError() ? "error" : "fleet")
                .data(update)
                .build());
    }

    @GetMapping("/status")
    public SyncStatus status() {
        return new SyncStatus(
            client.status(),
            distributor.activeSessions(),
            flights.pendingKeys(),
            store.isAvailable(),
            quotaMonitor.isMonitoring());
    }

    @GetMapping("/cache/stats")
    public Mono<List<CacheEntryStats>> cacheStats() {
        return store.stats();
    }

    @PostMapping("/cache/clear")
    public Mono<ResponseEntity<Void>> clearCache() {
        log.info("Cache clear requested");
        memory.clear();
        return store.clearAll()
            .then(Mono.just(ResponseEntity.ok().<Void>build()));
    }

    @GetMapping("/quota")
    public Mono<ResponseEntity<QuotaReport>> quota() {
        return quotaMonitor.checkQuota()
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.status(503).build());
    }

    @PostMapping("/client/reinitialize")
    public ClientStatus reinitialize() {
        client.reinitialize();
        return client.status();
    }

    @GetMapping("/client/test")
    public Mono<ConnectionTestResult> testConnection() {
        return client.testConnection();
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
