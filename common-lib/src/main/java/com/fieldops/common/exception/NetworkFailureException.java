package com.fieldops.common.exception;

/** Transport-level failure, including call timeouts and remote 5xx responses. */
public class NetworkFailureException extends FieldOpsException {

    public NetworkFailureException(String component, String message) {
        super(FailureKind.NETWORK_FAILURE, component, message);
    }

    public NetworkFailureException(String component, String message, Throwable cause) {
        super(FailureKind.NETWORK_FAILURE, component, message, cause);
    }
}
