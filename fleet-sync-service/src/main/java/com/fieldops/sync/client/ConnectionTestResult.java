package com.fieldops.sync.client;

public record ConnectionTestResult(
    boolean success,
    String message,
    int deviceCount,
    boolean mockMode
) {}
