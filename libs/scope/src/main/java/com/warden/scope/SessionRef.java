package com.warden.scope;

/**
 * A session picked up by the reconciliation sweep.
 *
 * @param sessionId session
 * @param key scope the session belongs to
 * @param sessionVersion scope version captured by the session
 * @param currentVersion scope version at sweep time
 * @param reason why the session needs attention
 */
public record SessionRef(
        String sessionId, ScopeKey key, long sessionVersion, long currentVersion, Reason reason) {

    public enum Reason {
        /** Captured version is behind the current version. */
        VERSION_BEHIND,
        /** Version is current but the last confirmed check is older than the allowed age. */
        CHECK_EXPIRED
    }

    public boolean isBehind() {
        return reason == Reason.VERSION_BEHIND;
    }
}
