package com.warden.security;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Total order over role levels, lowest first; a role dominates every role below it.
 *
 * <p>Built once at startup. The list form makes the hierarchy acyclic by construction; duplicates
 * are rejected.
 */
public final class RoleHierarchy {

    private final List<String> levels;

    private RoleHierarchy(List<String> levels) {
        this.levels = List.copyOf(levels);
    }

    /**
     * @param levelsLowestFirst role names ordered from least to most privileged
     * @throws RoleCatalogException if a name is blank or repeated
     */
    public static RoleHierarchy of(List<String> levelsLowestFirst) {
        Set<String> seen = new HashSet<>();
        for (String level : levelsLowestFirst) {
            if (level == null || level.isBlank()) {
                throw new RoleCatalogException("Role hierarchy contains a blank level");
            }
            if (!seen.add(level)) {
                throw new RoleCatalogException(
                        "Role '%s' appears more than once in the hierarchy".formatted(level));
            }
        }
        return new RoleHierarchy(levelsLowestFirst);
    }

    public static RoleHierarchy empty() {
        return new RoleHierarchy(List.of());
    }

    public boolean contains(String role) {
        return levels.contains(role);
    }

    /**
     * Roles strictly below {@code role}, lowest first. Empty for the lowest level and for roles
     * outside the hierarchy.
     */
    public List<String> dominatedBy(String role) {
        int index = levels.indexOf(role);
        return index <= 0 ? List.of() : levels.subList(0, index);
    }

    /** Levels, lowest first. */
    public List<String> levels() {
        return levels;
    }
}
