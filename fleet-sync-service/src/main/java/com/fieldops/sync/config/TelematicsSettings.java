package com.fieldops.sync.config;

import java.time.Duration;
import java.util.Optional;

/**
 * Already-validated telematics configuration. Loaded from properties by
 * {@link SyncConfig}; the client never reads configuration on its own.
 *
 * @param rateLimitWindow nominal window of the remote limiter; the client cools
 *                        down for twice this long after a rate-limit rejection
 */
public record TelematicsSettings(
    boolean enabled,
    boolean mockMode,
    String baseUrl,
    String database,
    String username,
    String password,
    Duration refreshInterval,
    Duration callTimeout,
    int maxRetries,
    Duration retryBaseDelay,
    Duration rateLimitWindow
) {

    public static final Duration DEFAULT_REFRESH_INTERVAL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_CALL_TIMEOUT     = Duration.ofSeconds(30);
    public static final int      DEFAULT_MAX_RETRIES      = 3;
    public static final Duration DEFAULT_RETRY_BASE_DELAY = Duration.ofSeconds(5);
    public static final Duration DEFAULT_RATE_LIMIT_WINDOW = Duration.ofMinutes(1);

    public Duration rateLimitCooldown() {
        return rateLimitWindow.multipliedBy(2);
    }

    public boolean hasCredentials() {
        return notBlank(database) && notBlank(username) && notBlank(password);
    }

    /**
     * Why the client cannot run against the remote API, if it cannot. Mock mode
     * needs no credentials.
     */
    public Optional<String> missingConfiguration() {
        if (!enabled) {
            return Optional.of("telematics integration disabled");
        }
        if (!mockMode && !hasCredentials()) {
            return Optional.of("telematics credentials missing (database, username, password)");
        }
        return Optional.empty();
    }

    /** Settings with every credential set, for the given environment. */
    public static TelematicsSettings of(String baseUrl, String database, String username, String password) {
        return new TelematicsSettings(true, false, baseUrl, database, username, password,
            DEFAULT_REFRESH_INTERVAL, DEFAULT_CALL_TIMEOUT, DEFAULT_MAX_RETRIES,
            DEFAULT_RETRY_BASE_DELAY, DEFAULT_RATE_LIMIT_WINDOW);
    }

    @Override
    public String toString() {
        return "TelematicsSettings[enabled=" + enabled + ", mockMode=" + mockMode
            + ", baseUrl=" + baseUrl + ", database=" + database + ", username=" + username
            + ", password=" + (notBlank(password) ? "***" : "<unset>")
            + ", refreshInterval=" + refreshInterval + ", callTimeout=" + callTimeout
            + ", maxRetries=" + maxRetries + ", retryBaseDelay=" + retryBaseDelay
            + ", rateLimitWindow=" + rateLimitWindow + "]";
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
