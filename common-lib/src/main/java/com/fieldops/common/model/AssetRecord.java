package com.fieldops.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Canonical fleet asset, assembled client-side from a device listing and its
 * latest status. Speed is already converted to display units (mph).
 */
public record AssetRecord(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("latitude") double latitude,
    @JsonProperty("longitude") double longitude,
    @JsonProperty("speedMph") int speedMph,
    @JsonProperty("bearing") double bearing,
    @JsonProperty("lastUpdated") Instant lastUpdated,
    @JsonProperty("communicationStatus") CommunicationStatus communicationStatus,
    @JsonProperty("category") AssetCategory category,
    @JsonProperty("installer") String installer,
    @JsonProperty("driving") boolean driving
) {}
