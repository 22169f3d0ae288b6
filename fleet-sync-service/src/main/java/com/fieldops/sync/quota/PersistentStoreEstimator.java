package com.fieldops.sync.quota;

import com.fieldops.sync.cache.PersistentCacheStore;
import reactor.core.publisher.Mono;

/**
 * Measures usage as the serialised size of everything in the persistent cache,
 * against a fixed byte budget from configuration.
 */
public class PersistentStoreEstimator implements StorageEstimator {

    private final PersistentCacheStore store;
    private final long capacityBytes;

    public PersistentStoreEstimator(PersistentCacheStore store, long capacityBytes) {
        this.store         = store;
        this.capacityBytes = capacityBytes;
    }

    @Override
    public Mono<StorageEstimate> estimate() {
        return store.usageBytes()
            .map(used -> new StorageEstimate(used, capacityBytes));
    }
}
