package com.fieldops.sync.quota;

import com.fieldops.sync.cache.PersistentCacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps the persistent cache inside its storage budget with a two-stage escalation:
 * <ol>
 *   <li>above {@value #EXPIRED_SWEEP_THRESHOLD}% used: drop expired entries, then re-sample;</li>
 *   <li>still above {@value #CLEAR_ALL_THRESHOLD}% after that: drop everything.</li>
 * </ol>
 *
 * <p>Monitoring runs on a {@code Flux.interval} ticker; the subscription is the
 * cancellation token. A check that fails is logged and skipped, never rethrown.
 */
public class StorageQuotaMonitor {

    private static final Logger log = LoggerFactory.getLogger(StorageQuotaMonitor.class);

    public static final double EXPIRED_SWEEP_THRESHOLD = 80.0;
    public static final double CLEAR_ALL_THRESHOLD     = 90.0;
    public static final Duration DEFAULT_INTERVAL      = Duration.ofMinutes(5);

    private final PersistentCacheStore store;
    private final StorageEstimator estimator;
    private final Scheduler scheduler;

    private final AtomicReference<Disposable> ticker = new AtomicReference<>();

    public StorageQuotaMonitor(PersistentCacheStore store, StorageEstimator estimator, Scheduler scheduler) {
        this.store     = store;
        this.estimator = estimator;
        this.scheduler = scheduler;
    }

    /**
     * Samples utilisation and escalates cleanup as needed.
     *
     * @return the report; empty when the estimate could not be taken
     */
    public Mono<QuotaReport> checkQuota() {
        return estimator.estimate()
            .flatMap(initial -> {
                double percent = initial.percentUsed();
                log.info("QUOTA_SAMPLE usedMb={} quotaMb={} percentUsed={}",
                         mb(initial.usageBytes()), mb(initial.quotaBytes()), pct(percent));

                if (percent <= EXPIRED_SWEEP_THRESHOLD) {
                    return Mono.just(new QuotaReport(initial, percent, QuotaAction.NONE));
                }

                log.warn("QUOTA_PRESSURE percentUsed={} action=clearExpired", pct(percent));
                return store.clearExpired()
                    .then(estimator.estimate())
                    .flatMap(after -> escalate(initial, after))
                    .defaultIfEmpty(new QuotaReport(initial, percent, QuotaAction.CLEARED_EXPIRED));
            })
            .onErrorResume(e -> {
                log.error("QUOTA_CHECK_FAILED reason={}", e.getMessage(), e);
                return Mono.empty();
            });
    }

    /** Checks immediately, then every {@code interval}. Restarting replaces the previous ticker. */
    public void startMonitoring(Duration interval) {
        Disposable next = Flux.interval(Duration.ZERO, interval, scheduler)
            .onBackpressureDrop()
            .concatMap(tick -> checkQuota())
            .subscribe(
                report -> log.debug("QUOTA_CHECK_DONE action={}", report.action()),
                err -> log.error("Quota monitoring stopped unexpectedly", err));
        Disposable previous = ticker.getAndSet(next);
        if (previous != null) {
            previous.dispose();
        }
        log.info("QUOTA_MONITORING_STARTED intervalMinutes={}", interval.toMinutes());
    }

    public void startMonitoring() {
        startMonitoring(DEFAULT_INTERVAL);
    }

    /** Cancels monitoring. Idempotent. */
    public void stopMonitoring() {
        Disposable current = ticker.getAndSet(null);
        if (current != null) {
            current.dispose();
            log.info("QUOTA_MONITORING_STOPPED");
        }
    }

    public boolean isMonitoring() {
        Disposable current = ticker.get();
        return current != null && !current.isDisposed();
    }

    private Mono<QuotaReport> escalate(StorageEstimate initial, StorageEstimate after) {
        double percentAfter = after.percentUsed();
        log.info("QUOTA_AFTER_CLEANUP percentUsed={}", pct(percentAfter));
        if (percentAfter <= CLEAR_ALL_THRESHOLD) {
            return Mono.just(new QuotaReport(initial, percentAfter, QuotaAction.CLEARED_EXPIRED));
        }
        log.warn("QUOTA_CRITICAL percentUsed={} action=clearAll", pct(percentAfter));
        return store.clearAll()
            .thenReturn(new QuotaReport(initial, percentAfter, QuotaAction.CLEARED_ALL));
    }

    private static String mb(long bytes) {
        return String.format(Locale.ROOT, "%.2f", bytes / 1024.0 / 1024.0);
    }

    private static String pct(double percent) {
        return String.format(Locale.ROOT, "%.1f", percent);
    }
}
