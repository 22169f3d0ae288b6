package com.fieldops.sync.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record JsonRpcRequest(
    @JsonProperty("method") String method,
    @JsonProperty("params") Map<String, Object> params
) {}
