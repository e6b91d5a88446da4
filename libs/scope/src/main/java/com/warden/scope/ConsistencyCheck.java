package com.warden.scope;

/**
 * Result of {@link SessionConsistencyChecker}.
 *
 * @param verdict the decision
 * @param sessionVersion version captured by the session, 0 when unknown
 * @param currentVersion current scope version, 0 when not looked up
 * @param reason short machine reason for INVALID verdicts, null otherwise
 */
public record ConsistencyCheck(
        ConsistencyVerdict verdict, long sessionVersion, long currentVersion, String reason) {

    public static ConsistencyCheck valid(long sessionVersion, long currentVersion) {
        return new ConsistencyCheck(ConsistencyVerdict.VALID, sessionVersion, currentVersion, null);
    }

    public static ConsistencyCheck stale(long sessionVersion, long currentVersion) {
        return new ConsistencyCheck(ConsistencyVerdict.STALE, sessionVersion, currentVersion, null);
    }

    public static ConsistencyCheck invalid(String reason) {
        return new ConsistencyCheck(ConsistencyVerdict.INVALID, 0, 0, reason);
    }

    public boolean isValid() {
        return verdict == ConsistencyVerdict.VALID;
    }
}
