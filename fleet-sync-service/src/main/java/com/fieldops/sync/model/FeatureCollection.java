package com.fieldops.sync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * GeoJSON feature collection as served by the plant-data layers. Features are
 * kept as raw JSON; only their count matters to the cache.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FeatureCollection(
    @JsonProperty("type") String type,
    @JsonProperty("features") List<JsonNode> features
) {

    public FeatureCollection {
        type = type == null ? "FeatureCollection" : type;
        features = features == null ? List.of() : List.copyOf(features);
    }

    public static FeatureCollection empty() {
        return new FeatureCollection("FeatureCollection", List.of());
    }

    public int size() {
        return features.size();
    }
}
