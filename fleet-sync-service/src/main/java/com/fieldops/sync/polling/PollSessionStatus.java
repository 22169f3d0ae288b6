package com.fieldops.sync.polling;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/** Diagnostics view of a {@link PollSession}; sequence numbers run 1..{@code deliveredCount}. */
public record PollSessionStatus(
    @JsonProperty("name") String name,
    @JsonProperty("interval") Duration interval,
    @JsonProperty("deliveredCount") long deliveredCount,
    @JsonProperty("skippedCycles") long skippedCycles
) {}
