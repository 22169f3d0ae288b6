package com.fieldops.common.model;

public enum CommunicationStatus {
    ONLINE,
    OFFLINE
}
