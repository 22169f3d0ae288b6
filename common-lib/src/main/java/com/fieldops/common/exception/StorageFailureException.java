package com.fieldops.common.exception;

/**
 * Persistent cache failure. Always recovered locally and treated as a cache miss;
 * it exists so the failure can be logged with its cause attached.
 */
public class StorageFailureException extends FieldOpsException {

    public StorageFailureException(String component, String message, Throwable cause) {
        super(FailureKind.STORAGE_FAILURE, component, message, cause);
    }
}
