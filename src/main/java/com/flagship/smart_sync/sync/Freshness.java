package com.flagship.smart_sync.sync;

public enum Freshness {
    FRESH,
    STALE,
    EXPIRED
}
