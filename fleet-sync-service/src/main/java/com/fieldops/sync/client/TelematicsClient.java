package com.fieldops.sync.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldops.common.exception.AuthenticationFailureException;
import com.fieldops.common.exception.ConfigurationMissingException;
import com.fieldops.common.exception.FieldOpsException;
import com.fieldops.common.exception.RateLimitExceededException;
import com.fieldops.sync.config.TelematicsSettings;
import com.fieldops.sync.flight.SingleFlightCoordinator;
import com.fieldops.sync.model.DeviceRecord;
import com.fieldops.sync.model.DeviceStatusRecord;
import com.fieldops.sync.model.TelematicsCredentials;
import com.fieldops.sync.model.TelematicsSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Authenticated client for the telematics API. Owns the {@link AuthState} machine;
 * nothing else mutates it.
 *
 * <p>Failure handling during authentication:
 * <ul>
 *   <li>rate limit: cool down for {@link TelematicsSettings#rateLimitCooldown()}; the retry
 *       counter is untouched and an authentication is attempted again once the window ends;</li>
 *   <li>anything else: retry after {@code retryBaseDelay × 2^(retryCount − 1)} while
 *       {@code retryCount < maxRetries}; after that the client stays unauthenticated until
 *       {@link #reinitialize()}.</li>
 * </ul>
 *
 * <p>Concurrent {@link #authenticate()} calls share one exchange through the
 * {@link SingleFlightCoordinator}. {@link #call} never queues: it fails fast with an
 * {@link AuthenticationFailureException} unless the client is authenticated.
 *
 * <p>When configuration is missing the client is disabled for its whole lifetime and
 * every operation fails with {@link ConfigurationMissingException} without touching
 * the network.
 */
public class TelematicsClient {

    private static final Logger log = LoggerFactory.getLogger(TelematicsClient.class);

    static final String COMPONENT       = "TelematicsClient";
    static final String AUTH_FLIGHT_KEY = "telematics:authenticate";

    private final TelematicsSettings settings;
    private final TelematicsTransport transport;
    private final SingleFlightCoordinator flights;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Scheduler scheduler;
    private final String disabledReason;

    private final AtomicReference<AuthStatus>        status              = new AtomicReference<>(AuthStatus.initial());
    private final AtomicReference<TelematicsSession> session             = new AtomicReference<>();
    private final AtomicReference<Disposable>        scheduledAttempt    = new AtomicReference<>();
    private final AtomicReference<Instant>           lastSuccessfulCall  = new AtomicReference<>();

    public TelematicsClient(TelematicsSettings settings,
                            TelematicsTransport transport,
                            SingleFlightCoordinator flights,
                            ObjectMapper objectMapper,
                            Clock clock,
                            Scheduler scheduler) {
        this.settings       = settings;
        this.transport      = transport;
        this.flights        = flights;
        this.objectMapper   = objectMapper;
        this.clock          = clock;
        this.scheduler      = scheduler;
        this.disabledReason = settings.missingConfiguration().orElse(null);

        if (disabledReason != null) {
            log.warn("TELEMATICS_DISABLED reason={}", disabledReason);
        } else {
            log.info("TELEMATICS_CLIENT_READY mockMode={} baseUrl={} maxRetries={}",
                     settings.mockMode(), settings.baseUrl(), settings.maxRetries());
        }
    }

    // ── authentication ───────────────────────────────────────────────────────

    /**
     * Ensures an authenticated session. Completes empty once authenticated, or errors with
     * the classified failure. Already-authenticated clients complete immediately.
     */
    public Mono<Void> authenticate() {
        return Mono.defer(() -> {
            if (disabledReason != null) {
                return Mono.error(new ConfigurationMissingException(COMPONENT, disabledReason));
            }
            refreshCooldown();

            AuthStatus current = status.get();
            if (current.state() == AuthState.AUTHENTICATED && session.get() != null) {
                return Mono.empty();
            }
            if (current.state() == AuthState.RATE_LIMITED) {
                return Mono.error(rateLimited(current.rateLimitResetAt()));
            }
            if (current.retriesExhausted()) {
                return Mono.error(new AuthenticationFailureException(COMPONENT,
                    "authentication retries exhausted after " + current.retryCount()
                        + " attempts; reinitialize required"));
            }
            return flights.execute(AUTH_FLIGHT_KEY, this::exchangeCredentials).then();
        });
    }

    /** {@code true} while a rate-limit cooldown is running. Ends the cooldown once it has elapsed. */
    public boolean isRateLimited() {
        refreshCooldown();
        return status.get().state() == AuthState.RATE_LIMITED;
    }

    public boolean isAuthenticated() {
        return status.get().state() == AuthState.AUTHENTICATED && session.get() != null;
    }

    public boolean isEnabled() {
        return disabledReason == null;
    }

    public AuthStatus authStatus() {
        return status.get();
    }

    // ── data calls ───────────────────────────────────────────────────────────

    /**
     * Performs one remote operation with the current session.
     *
     * @return the raw result node
     */
    public Mono<JsonNode> call(String operation, Map<String, Object> params) {
        return Mono.defer(() -> {
            if (disabledReason != null) {
                return Mono.error(new ConfigurationMissingException(COMPONENT, disabledReason));
            }
            TelematicsSession current = session.get();
            if (status.get().state() != AuthState.AUTHENTICATED || current == null) {
                return Mono.error(new AuthenticationFailureException(COMPONENT,
                    "not authenticated (state=" + status.get().state() + ")"));
            }

            return transport.call(current, operation, params)
                .timeout(settings.callTimeout(), scheduler)
                .doOnNext(result -> lastSuccessfulCall.set(clock.instant()))
                .onErrorMap(e -> onCallFailure(operation, FailureClassifier.classify(COMPONENT, e)));
        });
    }

    public Mono<List<DeviceRecord>> getDevices() {
        return call("Get", Map.of("typeName", "Device"))
            .map(node -> convert(node, new TypeReference<List<DeviceRecord>>() {}));
    }

    public Mono<List<DeviceStatusRecord>> getDeviceStatuses() {
        return call("Get", Map.of("typeName", "DeviceStatusInfo"))
            .map(node -> convert(node, new TypeReference<List<DeviceStatusRecord>>() {}));
    }

    // ── lifecycle / diagnostics ──────────────────────────────────────────────

    /**
     * Clears the session, the retry counter and any cooldown, cancelling pending
     * scheduled attempts. The only way out of the exhausted-retries state.
     */
    public void reinitialize() {
        cancelScheduledAttempt();
        session.set(null);
        transition(s -> AuthStatus.initial());
        log.info("TELEMATICS_REINITIALIZED");
    }

    /** Cancels scheduled attempts and drops the session. Idempotent. */
    public void shutdown() {
        cancelScheduledAttempt();
        session.set(null);
        transition(AuthStatus::sessionLost);
        log.info("TELEMATICS_CLIENT_SHUTDOWN");
    }

    public ClientStatus status() {
        refreshCooldown();
        AuthStatus current = status.get();
        return new ClientStatus(
            isEnabled(),
            settings.mockMode(),
            disabledReason,
            current.state(),
            current.retryCount(),
            current.retriesExhausted(),
            current.rateLimitResetAt(),
            lastSuccessfulCall.get());
    }

    /** Authenticates and lists devices. Never errors; failures are reported in the result. */
    public Mono<ConnectionTestResult> testConnection() {
        return authenticate()
            .then(getDevices())
            .map(devices -> new ConnectionTestResult(true,
                "Connected successfully. Found " + devices.size() + " devices.",
                devices.size(), settings.mockMode()))
            .onErrorResume(e -> Mono.just(new ConnectionTestResult(false,
                FailureClassifier.classify(COMPONENT, e).getMessage(), 0, settings.mockMode())));
    }

    /** Delay before retry number {@code retryCount} (1-based): {@code base × 2^(retryCount − 1)}. */
    static Duration backoffDelay(Duration base, int retryCount) {
        int exponent = Math.max(0, retryCount - 1);
        return base.multipliedBy(1L << Math.min(exponent, 30));
    }

    // ── private ───────────────────────────────────────────────────────────────

    private Mono<TelematicsSession> exchangeCredentials() {
        transition(AuthStatus::authenticating);
        TelematicsCredentials credentials =
            new TelematicsCredentials(settings.database(), settings.username(), settings.password());

        return transport.authenticate(credentials)
            .timeout(settings.callTimeout(), scheduler)
            .switchIfEmpty(Mono.error(() ->
                new AuthenticationFailureException(COMPONENT, "authentication returned no session")))
            .doOnNext(this::onAuthenticated)
            .onErrorMap(e -> onAuthenticationFailure(FailureClassifier.classify(COMPONENT, e)));
    }

    private void onAuthenticated(TelematicsSession issued) {
        cancelScheduledAttempt();
        session.set(issued);
        transition(AuthStatus::authenticated);
        log.info("TELEMATICS_AUTHENTICATED database={} user={} session={}",
                 issued.database(), issued.userName(), issued.maskedSessionId());
    }

    private FieldOpsException onAuthenticationFailure(FieldOpsException failure) {
        session.set(null);

        if (failure instanceof RateLimitExceededException) {
            Instant resetAt = clock.instant().plus(settings.rateLimitCooldown());
            AuthStatus next = transition(s -> s.rateLimited(resetAt));
            log.warn("TELEMATICS_RATE_LIMITED phase=authenticate resetAt={} retryCount={}",
                     resetAt, next.retryCount());
            scheduleAttempt(settings.rateLimitCooldown(), "cooldown");
            return rateLimited(resetAt);
        }

        int retries = status.get().retryCount() + 1;
        if (retries < settings.maxRetries()) {
            transition(s -> s.failed(retries, false));
            Duration delay = backoffDelay(settings.retryBaseDelay(), retries);
            log.warn("TELEMATICS_AUTH_FAILED kind={} retry={}/{} nextAttemptInMs={} reason={}",
                     failure.getKind(), retries, settings.maxRetries(), delay.toMillis(), failure.getMessage());
            scheduleAttempt(delay, "backoff");
        } else {
            transition(s -> s.failed(retries, true));
            log.error("TELEMATICS_AUTH_EXHAUSTED kind={} attempts={} reason={}",
                      failure.getKind(), retries, failure.getMessage());
        }
        return failure;
    }

    private FieldOpsException onCallFailure(String operation, FieldOpsException failure) {
        switch (failure.getKind()) {
            case RATE_LIMIT_EXCEEDED -> {
                Instant resetAt = clock.instant().plus(settings.rateLimitCooldown());
                session.set(null);
                transition(s -> s.rateLimited(resetAt));
                log.warn("TELEMATICS_RATE_LIMITED phase=call operation={} resetAt={}", operation, resetAt);
                scheduleAttempt(settings.rateLimitCooldown(), "cooldown");
                return rateLimited(resetAt);
            }
            case AUTHENTICATION_FAILURE -> {
                session.set(null);
                transition(AuthStatus::sessionLost);
                log.warn("TELEMATICS_SESSION_LOST operation={} reason={}", operation, failure.getMessage());
            }
            default -> log.warn("TELEMATICS_CALL_FAILED operation={} kind={} reason={}",
                                operation, failure.getKind(), failure.getMessage());
        }
        return failure;
    }

    /** RATE_LIMITED → UNAUTHENTICATED once {@code now >= resetAt}. */
    private void refreshCooldown() {
        Instant now = clock.instant();
        AuthStatus before = status.get();
        if (before.state() != AuthState.RATE_LIMITED || now.isBefore(before.rateLimitResetAt())) {
            return;
        }
        if (status.compareAndSet(before, before.cooledDown())) {
            log.info("AUTH_STATE_CHANGE from={} to={} reason=cooldown ended resetAt={}",
                     AuthState.RATE_LIMITED, AuthState.UNAUTHENTICATED, before.rateLimitResetAt());
        }
    }

    private AuthStatus transition(UnaryOperator<AuthStatus> change) {
        AuthStatus before;
        AuthStatus after;
        do {
            before = status.get();
            after  = change.apply(before);
        } while (!status.compareAndSet(before, after));
        if (before.state() != after.state()) {
            log.info("AUTH_STATE_CHANGE from={} to={} retryCount={}", before.state(), after.state(), after.retryCount());
        }
        return after;
    }

    private void scheduleAttempt(Duration delay, String reason) {
        Disposable next = scheduler.schedule(() -> {
            log.info("TELEMATICS_SCHEDULED_ATTEMPT reason={}", reason);
            authenticate().subscribe(
                ignored -> { },
                e -> log.debug("TELEMATICS_SCHEDULED_ATTEMPT_FAILED reason={} error={}", reason, e.getMessage()));
        }, delay.toMillis(), TimeUnit.MILLISECONDS);

        Disposable previous = scheduledAttempt.getAndSet(next);
        if (previous != null) {
            previous.dispose();
        }
    }

    private void cancelScheduledAttempt() {
        Disposable previous = scheduledAttempt.getAndSet(null);
        if (previous != null) {
            previous.dispose();
        }
    }

    private RateLimitExceededException rateLimited(Instant resetAt) {
        return new RateLimitExceededException(COMPONENT,
            "rate limited until " + resetAt, resetAt, null);
    }

    private <T> T convert(JsonNode node, TypeReference<T> type) {
        return objectMapper.convertValue(node, type);
    }
}
