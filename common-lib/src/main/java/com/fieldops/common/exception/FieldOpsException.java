package com.fieldops.common.exception;

public abstract class FieldOpsException extends RuntimeException {
    private final FailureKind kind;
    private final String component;

    protected FieldOpsException(FailureKind kind, String component, String message) {
        super("[" + component + "] " + message);
        this.kind = kind;
        this.component = component;
    }

    protected FieldOpsException(FailureKind kind, String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.kind = kind;
        this.component = component;
    }

    public FailureKind getKind() {
        return kind;
    }

    public String getComponent() {
        return component;
    }
}
