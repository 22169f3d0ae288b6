package com.fieldops.common.exception;

public class ConfigurationMissingException extends FieldOpsException {

    public ConfigurationMissingException(String component, String message) {
        super(FailureKind.CONFIGURATION_MISSING, component, message);
    }
}
