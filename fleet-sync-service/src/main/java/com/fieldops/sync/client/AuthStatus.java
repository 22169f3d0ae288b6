package com.fieldops.sync.client;

import java.time.Instant;

/**
 * Immutable snapshot of the client's authentication state machine.
 *
 * @param rateLimitResetAt end of the cooldown window; only set in {@link AuthState#RATE_LIMITED}
 * @param retryCount       consecutive non-rate-limit authentication failures
 * @param retriesExhausted {@code true} once automatic retries stopped; cleared only by re-initialisation
 */
public record AuthStatus(
    AuthState state,
    Instant rateLimitResetAt,
    int retryCount,
    boolean retriesExhausted
) {

    public static AuthStatus initial() {
        return new AuthStatus(AuthState.UNAUTHENTICATED, null, 0, false);
    }

    AuthStatus authenticating() {
        return new AuthStatus(AuthState.AUTHENTICATING, null, retryCount, retriesExhausted);
    }

    AuthStatus authenticated() {
        return new AuthStatus(AuthState.AUTHENTICATED, null, 0, false);
    }

    AuthStatus rateLimited(Instant resetAt) {
        return new AuthStatus(AuthState.RATE_LIMITED, resetAt, retryCount, retriesExhausted);
    }

    AuthStatus failed(int retries, boolean exhausted) {
        return new AuthStatus(AuthState.UNAUTHENTICATED, null, retries, exhausted);
    }

    AuthStatus sessionLost() {
        return new AuthStatus(AuthState.UNAUTHENTICATED, null, retryCount, retriesExhausted);
    }

    AuthStatus cooledDown() {
        return new AuthStatus(AuthState.UNAUTHENTICATED, null, retryCount, retriesExhausted);
    }
}
