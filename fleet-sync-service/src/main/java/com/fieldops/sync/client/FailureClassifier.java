package com.fieldops.sync.client;

import com.fieldops.common.exception.AuthenticationFailureException;
import com.fieldops.common.exception.FieldOpsException;
import com.fieldops.common.exception.NetworkFailureException;
import com.fieldops.common.exception.RateLimitExceededException;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Pure stateless mapping of any failure seen by the telematics client onto exactly
 * one member of the failure taxonomy.
 *
 * <p>Rules (evaluated in order):
 * <ol>
 *   <li>already a {@link FieldOpsException} → unchanged</li>
 *   <li>{@link TimeoutException}             → network failure ("timed out")</li>
 *   <li>HTTP 429 / {@code OverLimitException} → rate limit exceeded</li>
 *   <li>HTTP 401, 403 / invalid user or session errors → authentication failure</li>
 *   <li>anything else                        → network failure</li>
 * </ol>
 */
public final class FailureClassifier {

    private static final Set<String> RATE_LIMIT_ERRORS = Set.of("OverLimitException");

    private static final Set<String> AUTHENTICATION_ERRORS = Set.of(
        "InvalidUserException",
        "InvalidSessionException",
        "InvalidPasswordException");

    private FailureClassifier() {}

    public static FieldOpsException classify(String component, Throwable failure) {
        Throwable error = Exceptions.unwrap(failure);

        if (error instanceof FieldOpsException classified) {
            return classified;
        }
        if (error instanceof TimeoutException) {
            return new NetworkFailureException(component, "remote call timed out", error);
        }
        if (error instanceof WebClientResponseException http) {
            return classifyHttp(component, http);
        }
        if (error instanceof TelematicsApiException api) {
            return classifyApiError(component, api);
        }
        return new NetworkFailureException(component, describe(error), error);
    }

    private static FieldOpsException classifyHttp(String component, WebClientResponseException http) {
        int status = http.getStatusCode().value();
        if (status == HttpStatus.TOO_MANY_REQUESTS.value()) {
            return new RateLimitExceededException(component, "HTTP 429 from telematics API", null, http);
        }
        if (status == HttpStatus.UNAUTHORIZED.value() || status == HttpStatus.FORBIDDEN.value()) {
            return new AuthenticationFailureException(component, "HTTP " + status + " from telematics API", http);
        }
        return new NetworkFailureException(component, "HTTP " + status + " from telematics API", http);
    }

    private static FieldOpsException classifyApiError(String component, TelematicsApiException api) {
        if (RATE_LIMIT_ERRORS.contains(api.getErrorName())) {
            return new RateLimitExceededException(component, api.getMessage(), null, api);
        }
        if (AUTHENTICATION_ERRORS.contains(api.getErrorName())) {
            return new AuthenticationFailureException(component, api.getMessage(), api);
        }
        return new NetworkFailureException(component, api.getMessage(), api);
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
