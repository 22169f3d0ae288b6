package com.fieldops.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Outcome of one "get current data" request. Always well-formed: on failure
 * {@code payload} holds the best cached value (or the dataset's empty value)
 * and {@code error} carries the failure message.
 *
 * @param payload   dataset payload, never {@code null}
 * @param source    {@link SourceTag#NETWORK} only for a fresh remote fetch
 * @param stale     {@code true} when served past its TTL or as an empty fallback
 * @param error     failure message, {@code null} on success
 * @param timestamp when the payload was produced (fetch time, or cache stamp)
 */
public record FetchResult<T>(
    @JsonProperty("payload") T payload,
    @JsonProperty("source") SourceTag source,
    @JsonProperty("stale") boolean stale,
    @JsonProperty("error") String error,
    @JsonProperty("timestamp") Instant timestamp
) {

    public static <T> FetchResult<T> network(T payload, Instant fetchedAt) {
        return new FetchResult<>(payload, SourceTag.NETWORK, false, null, fetchedAt);
    }

    public static <T> FetchResult<T> cached(T payload, Instant cachedAt) {
        return new FetchResult<>(payload, SourceTag.CACHE, false, null, cachedAt);
    }

    public static <T> FetchResult<T> stale(T payload, Instant cachedAt, String error) {
        return new FetchResult<>(payload, SourceTag.CACHE, true, error, cachedAt);
    }

    public static <T> FetchResult<T> empty(T emptyPayload, Instant now, String error) {
        return new FetchResult<>(emptyPayload, SourceTag.CACHE, true, error, now);
    }

    public boolean hasError() {
        return error != null;
    }
}
