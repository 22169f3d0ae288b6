package com.fieldops.sync.config;

import com.fieldops.sync.cache.PersistentCacheStore;
import com.fieldops.sync.client.TelematicsClient;
import com.fieldops.sync.polling.PollingDistributor;
import com.fieldops.sync.quota.StorageQuotaMonitor;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;

/**
 * Start-up and tear-down of the long-lived parts of the sync layer.
 *
 * <p>On start: open the persistent store, begin quota monitoring after a short
 * delay and, when the client is enabled, authenticate once in the background.
 * On stop: end every poll session, stop monitoring, shut the client down.
 */
@Component
public class SyncLifecycle {

    private static final Logger log = LoggerFactory.getLogger(SyncLifecycle.class);

    private final PersistentCacheStore store;
    private final StorageQuotaMonitor quotaMonitor;
    private final TelematicsClient client;
    private final PollingDistributor distributor;
    private final Scheduler scheduler;

    @Value("${fieldops.quota.interval:5m}")
    private Duration quotaInterval;

    @Value("${fieldops.quota.start-delay:5s}")
    private Duration quotaStartDelay;

    private volatile Disposable startup;

    public SyncLifecycle(PersistentCacheStore store, StorageQuotaMonitor quotaMonitor,
                         TelematicsClient client, PollingDistributor distributor,
                         Scheduler syncScheduler) {
        this.store        = store;
        this.quotaMonitor = quotaMonitor;
        this.client       = client;
        this.distributor  = distributor;
        this.scheduler    = syncScheduler;
    }

    @PostConstruct
    public void start() {
        log.info("Sync layer starting. quotaIntervalMinutes={} quotaStartDelaySeconds={}",
                 quotaInterval.toMinutes(), quotaStartDelay.toSeconds());

        startup = store.open()
            .doOnNext(available -> log.info("Persistent cache open. available={}", available))
            .then(Mono.delay(quotaStartDelay, scheduler))
            .subscribe(
                tick -> quotaMonitor.startMonitoring(quotaInterval),
                err -> log.error("Sync start-up failed", err));

        if (client.isEnabled()) {
            client.authenticate().subscribe(
                ignored -> { },
                err -> log.warn("Initial telematics authentication failed: {}", err.getMessage()));
        }
    }

    @PreDestroy
    public void stop() {
        Disposable pending = startup;
        if (pending != null) {
            pending.dispose();
        }
        distributor.stopAll();
        quotaMonitor.stopMonitoring();
        client.shutdown();
        log.info("Sync layer stopped");
    }
}
