package com.warden.scope;

/**
 * Answer of the token-validation collaborator: either the authentic session behind a token, or a
 * rejection reason.
 */
public record TokenVerdict(SessionSnapshot session, String rejectionReason) {

    public static final String UNKNOWN_TOKEN = "unknown_token";
    public static final String SESSION_INACTIVE = "session_inactive";
    public static final String SESSION_EXPIRED = "session_expired";

    public TokenVerdict {
        if ((session == null) == (rejectionReason == null)) {
            throw new IllegalArgumentException("exactly one of session and rejectionReason is required");
        }
    }

    public static TokenVerdict authentic(SessionSnapshot session) {
        return new TokenVerdict(session, null);
    }

    public static TokenVerdict rejected(String reason) {
        return new TokenVerdict(null, reason);
    }

    public boolean isAuthentic() {
        return session != null;
    }
}
