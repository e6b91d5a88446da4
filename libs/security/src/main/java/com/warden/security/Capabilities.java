package com.warden.security;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Grammar and matching rules for capability strings.
 *
 * <p>A capability is one of three shapes: {@code namespace:action}, {@code namespace:*} (or an
 * action ending in a bare {@code *}, which matches by prefix), or the universal wildcard
 * {@code *}. Role configuration files and every authorization check depend on this grammar.
 *
 * <p>{@link #hasCapability} is total and side-effect free over plain strings.
 */
public final class Capabilities {

    /** The universal wildcard; grants everything. */
    public static final String WILDCARD = "*";

    private static final Pattern FORMAT =
            Pattern.compile("^[A-Za-z0-9_.-]+:(?:[A-Za-z0-9_.-]+\\*?|\\*)$");

    private Capabilities() {
        // utility class
    }

    /**
     * Checks whether an effective capability set satisfies {@code required}.
     *
     * <ul>
     *   <li>{@code *} in the set grants everything
     *   <li>an exact match grants
     *   <li>an entry ending in {@code *} grants any capability starting with the part before it
     *       ({@code app:*} grants {@code app:login})
     * </ul>
     *
     * Linear in the size of {@code effective}.
     */
    public static boolean hasCapability(Set<String> effective, String required) {
        if (effective == null || effective.isEmpty() || required == null) {
            return false;
        }
        if (effective.contains(WILDCARD) || effective.contains(required)) {
            return true;
        }
        for (String capability : effective) {
            if (capability.endsWith(WILDCARD)) {
                String prefix = capability.substring(0, capability.length() - 1);
                if (required.startsWith(prefix)) {
                    return true;
                }
            }
        }
        return false;
    }

    /** Returns true if {@code effective} satisfies every one of {@code required}. */
    public static boolean hasAll(Set<String> effective, Collection<String> required) {
        for (String capability : required) {
            if (!hasCapability(effective, capability)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns true iff {@code capability} is {@code *} or two non-empty {@code [A-Za-z0-9_.-]}
     * segments separated by one colon, the second optionally ending in a bare {@code *}.
     */
    public static boolean isValidFormat(String capability) {
        if (capability == null || capability.isEmpty()) {
            return false;
        }
        return WILDCARD.equals(capability) || FORMAT.matcher(capability).matches();
    }

    /** Returns the members of {@code capabilities} that are not well formed, in input order. */
    public static List<String> invalidEntries(Collection<String> capabilities) {
        List<String> invalid = new ArrayList<>();
        for (String capability : capabilities) {
            if (!isValidFormat(capability)) {
                invalid.add(capability);
            }
        }
        return invalid;
    }

    /**
     * Rejects a collection holding any malformed capability.
     *
     * @throws CapabilityFormatException listing every malformed entry
     */
    public static void requireValid(Collection<String> capabilities) {
        List<String> invalid = invalidEntries(capabilities);
        if (!invalid.isEmpty()) {
            throw new CapabilityFormatException(invalid);
        }
    }
}
