package com.fieldops.sync.quota;

/**
 * Result of one quota check.
 *
 * @param initial             sample taken before any cleanup
 * @param percentAfterCleanup re-sampled utilisation after {@code clearExpired()};
 *                            equal to the initial percentage when no cleanup ran
 * @param action              the most drastic cleanup that was performed
 */
public record QuotaReport(
    StorageEstimate initial,
    double percentAfterCleanup,
    QuotaAction action
) {

    public double percentUsed() {
        return initial.percentUsed();
    }
}
