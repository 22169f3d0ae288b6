package com.fieldops.sync.client;

import java.time.Instant;

/** Diagnostics view of {@link TelematicsClient}. */
public record ClientStatus(
    boolean enabled,
    boolean mockMode,
    String disabledReason,
    AuthState state,
    int retryCount,
    boolean retriesExhausted,
    Instant rateLimitResetAt,
    Instant lastSuccessfulCall
) {}
