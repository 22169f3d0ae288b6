package com.fieldops.sync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Entry of the "get device status" operation. Speed is in km/h as reported by the
 * provider; conversion to display units happens in the fetch layer.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DeviceStatusRecord(
    @JsonProperty("device") DeviceRef device,
    @JsonProperty("latitude") Double latitude,
    @JsonProperty("longitude") Double longitude,
    @JsonProperty("speed") Double speed,
    @JsonProperty("bearing") Double bearing,
    @JsonProperty("dateTime") String dateTime,
    @JsonProperty("isDeviceCommunicating") boolean deviceCommunicating
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DeviceRef(
        @JsonProperty("id") String id
    ) {}

    public String deviceId() {
        return device == null ? null : device.id();
    }

    public boolean hasPosition() {
        return latitude != null && longitude != null && latitude != 0.0 && longitude != 0.0;
    }
}
