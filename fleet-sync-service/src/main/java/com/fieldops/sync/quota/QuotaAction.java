package com.fieldops.sync.quota;

public enum QuotaAction {
    NONE,
    CLEARED_EXPIRED,
    CLEARED_ALL
}
