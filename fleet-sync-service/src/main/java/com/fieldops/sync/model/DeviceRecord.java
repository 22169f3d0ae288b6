package com.fieldops.sync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Entry of the "list devices" operation. {@code comment} holds the assigned installer. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DeviceRecord(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("comment") String comment
) {}
