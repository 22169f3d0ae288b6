package com.fieldops.sync.quota;

import reactor.core.publisher.Mono;

/**
 * Samples how much of the client's storage budget is in use. Swapped for a
 * scripted implementation in tests.
 */
public interface StorageEstimator {
    Mono<StorageEstimate> estimate();
}
