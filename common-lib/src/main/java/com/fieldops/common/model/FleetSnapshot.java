package com.fieldops.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * All fleet assets known at one point in time. This is the payload of the
 * {@code fleetAssets} dataset in both cache tiers.
 */
public record FleetSnapshot(
    @JsonProperty("assets") List<AssetRecord> assets
) {

    public FleetSnapshot {
        assets = assets == null ? List.of() : List.copyOf(assets);
    }

    public static FleetSnapshot empty() {
        return new FleetSnapshot(List.of());
    }

    @JsonIgnore
    public List<AssetRecord> fiber() {
        return byCategory(AssetCategory.FIBER);
    }

    @JsonIgnore
    public List<AssetRecord> electric() {
        return byCategory(AssetCategory.ELECTRIC);
    }

    @JsonIgnore
    public int size() {
        return assets.size();
    }

    private List<AssetRecord> byCategory(AssetCategory category) {
        return assets.stream()
            .filter(a -> a.category() == category)
            .toList();
    }
}
