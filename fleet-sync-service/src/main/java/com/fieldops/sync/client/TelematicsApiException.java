package com.fieldops.sync.client;

/**
 * Error object returned inside a JSON-RPC response body. Classified into the
 * failure taxonomy by {@link FailureClassifier}.
 */
public class TelematicsApiException extends RuntimeException {
    private final String errorName;

    public TelematicsApiException(String errorName, String message) {
        super(errorName + ": " + message);
        this.errorName = errorName;
    }

    public String getErrorName() {
        return errorName;
    }
}
