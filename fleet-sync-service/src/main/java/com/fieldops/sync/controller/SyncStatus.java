package com.fieldops.sync.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fieldops.sync.client.ClientStatus;
import com.fieldops.sync.polling.PollSessionStatus;

import java.util.List;
import java.util.Set;

/** Everything the diagnostics page shows about the sync layer at one instant. */
public record SyncStatus(
    @JsonProperty("client") ClientStatus client,
    @JsonProperty("pollSessions") List<PollSessionStatus> pollSessions,
    @JsonProperty("pendingFlights") Set<String> pendingFlights,
    @JsonProperty("storeAvailable") boolean storeAvailable,
    @JsonProperty("quotaMonitoring") boolean quotaMonitoring
) {}
