package com.fieldops.sync.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fieldops.common.model.FleetSnapshot;
import com.fieldops.sync.model.FeatureCollection;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Every dataset the dashboard caches. Plant layers are GeoJSON feature
 * collections that change a few times a year; the fleet layer is live.
 */
public final class DatasetCatalog {

    public static final DatasetType<FleetSnapshot> FLEET_ASSETS = new DatasetType<>(
        "fleetAssets", new TypeReference<FleetSnapshot>() {}, FleetSnapshot::empty, FleetSnapshot::size);

    public static final DatasetType<FeatureCollection> FSA           = plantLayer("fsa");
    public static final DatasetType<FeatureCollection> MAIN_FIBER    = plantLayer("mainFiber");
    public static final DatasetType<FeatureCollection> MAIN_OLD      = plantLayer("mainOld");
    public static final DatasetType<FeatureCollection> MST_FIBER     = plantLayer("mstFiber");
    public static final DatasetType<FeatureCollection> MST_TERMINALS = plantLayer("mstTerminals");
    public static final DatasetType<FeatureCollection> CLOSURES      = plantLayer("closures");
    public static final DatasetType<FeatureCollection> SPLITTERS     = plantLayer("splitters");
    public static final DatasetType<FeatureCollection> NODE_SITES    = plantLayer("nodeSites");

    private static final Map<String, DatasetType<?>> BY_KEY = index(
        FLEET_ASSETS, FSA, MAIN_FIBER, MAIN_OLD, MST_FIBER,
        MST_TERMINALS, CLOSURES, SPLITTERS, NODE_SITES);

    private DatasetCatalog() {}

    public static Optional<DatasetType<?>> find(String key) {
        return Optional.ofNullable(BY_KEY.get(key));
    }

    public static Collection<DatasetType<?>> all() {
        return BY_KEY.values();
    }

    private static DatasetType<FeatureCollection> plantLayer(String key) {
        return new DatasetType<>(key, new TypeReference<FeatureCollection>() {},
                                 FeatureCollection::empty, FeatureCollection::size);
    }

    private static Map<String, DatasetType<?>> index(DatasetType<?>... types) {
        Map<String, DatasetType<?>> byKey = new LinkedHashMap<>();
        for (DatasetType<?> type : types) {
            byKey.put(type.key(), type);
        }
        return Map.copyOf(byKey);
    }
}
