package com.fieldops.sync.quota;

/**
 * One sample of storage utilisation.
 *
 * @param usageBytes bytes currently used
 * @param quotaBytes capacity available to the cache; non-positive means unknown
 */
public record StorageEstimate(long usageBytes, long quotaBytes) {

    public double percentUsed() {
        if (quotaBytes <= 0) {
            return 0.0;
        }
        return (usageBytes * 100.0) / quotaBytes;
    }
}
