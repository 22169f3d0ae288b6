package com.fieldops.sync.polling;

/**
 * What happens to a cycle that was already in flight when its session was stopped.
 */
public enum LateDeliveryPolicy {
    /** Deliver the in-flight result to the callback anyway. */
    DELIVER,
    /** Discard it; nothing reaches the callback after {@code stop}. */
    DROP
}
