package com.warden.scope;

import java.util.Locale;

/** Outcome of a session consistency check. */
public enum ConsistencyVerdict {
    /** Session is authentic and current. */
    VALID,
    /** Session is authentic but was issued against an older scope version. */
    STALE,
    /** Session is expired, inactive or not authentic. */
    INVALID;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
