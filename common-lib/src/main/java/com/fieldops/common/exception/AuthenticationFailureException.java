package com.fieldops.common.exception;

public class AuthenticationFailureException extends FieldOpsException {

    public AuthenticationFailureException(String component, String message) {
        super(FailureKind.AUTHENTICATION_FAILURE, component, message);
    }

    public AuthenticationFailureException(String component, String message, Throwable cause) {
        super(FailureKind.AUTHENTICATION_FAILURE, component, message, cause);
    }
}
