package com.fieldops.common.exception;

import java.time.Instant;

/**
 * The remote limiter rejected a request. {@code resetAt} is filled in once the
 * client has entered its cooldown window; it is {@code null} when thrown by a
 * transport that does not know the window.
 */
public class RateLimitExceededException extends FieldOpsException {
    private final Instant resetAt;

    public RateLimitExceededException(String component, String message) {
        this(component, message, null, null);
    }

    public RateLimitExceededException(String component, String message, Instant resetAt, Throwable cause) {
        super(FailureKind.RATE_LIMIT_EXCEEDED, component, message, cause);
        this.resetAt = resetAt;
    }

    public Instant getResetAt() {
        return resetAt;
    }
}
