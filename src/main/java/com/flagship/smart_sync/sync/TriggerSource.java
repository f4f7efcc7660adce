package com.flagship.smart_sync.sync;

public enum TriggerSource {
    SCHEDULED,
    WEBHOOK,
    MANUAL,
    FRESHNESS,
    RETRY
}
