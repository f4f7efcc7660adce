package com.flagship.smart_sync.log;

/**
 * Provenance of a change: a rail id for synced changes, {@link #USER} for local actions.
 */
public final class ChangeSource {

    public static final String USER = "user";

    private ChangeSource() {
    }

    public static boolean isUser(String source) {
        return USER.equals(source);
    }
}
