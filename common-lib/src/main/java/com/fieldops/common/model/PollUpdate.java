package com.fieldops.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One delivery to a poll subscriber. A data update carries a payload; an error
 * update carries {@code payload == null} and a non-null {@code error}. Sequence
 * numbers are per session, start at 1 and increase by one per delivery.
 */
public record PollUpdate<T>(
    @JsonProperty("session") String session,
    @JsonProperty("payload") T payload,
    @JsonProperty("source") SourceTag source,
    @JsonProperty("stale") boolean stale,
    @JsonProperty("error") String error,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("sequenceNumber") long sequenceNumber
) {

    public static <T> PollUpdate<T> of(String session, FetchResult<T> result, Instant deliveredAt, long sequence) {
        return new PollUpdate<>(session, result.payload(), result.source(), result.stale(),
                                result.error(), deliveredAt, sequence);
    }

    public static <T> PollUpdate<T> failure(String session, String error, Instant deliveredAt, long sequence) {
        return new PollUpdate<>(session, null, SourceTag.CACHE, true, error, deliveredAt, sequence);
    }

    public boolean isError() {
        return payload == null && error != null;
    }
}
