package com.flagship.smart_sync.view;

/**
 * Data-quality problems that keep a bill out of payment decisions.
 */
public enum HygieneIssue {
    MISSING_VENDOR(true),
    MISSING_DUE_DATE(true),
    INVALID_AMOUNT(true),
    NOT_SYNCED(false);

    private final boolean blocking;

    HygieneIssue(boolean blocking) {
        this.blocking = blocking;
    }

    /**
     * Blocking issues make an item urgent regardless of its due date.
     */
    public boolean isBlocking() {
        return blocking;
    }
}
