package com.fieldops.common.model;

/**
 * Where a delivered payload came from. {@link #CACHE} covers both the memory
 * tier and the persistent tier.
 */
public enum SourceTag {
    NETWORK,
    CACHE
}
