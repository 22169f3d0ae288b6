package com.fieldops.common.exception;

/**
 * Closed error taxonomy of the synchronization layer. Every failure observed by
 * the remote client classifies into exactly one of these.
 */
public enum FailureKind {
    AUTHENTICATION_FAILURE,
    RATE_LIMIT_EXCEEDED,
    NETWORK_FAILURE,
    STORAGE_FAILURE,
    CONFIGURATION_MISSING
}
