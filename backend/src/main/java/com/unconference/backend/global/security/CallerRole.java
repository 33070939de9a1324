package com.unconference.backend.global.security;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;

/**
 * Roles handed out by the identity service, lowest privilege first.
 */
public enum CallerRole {
    VIEWER,
    FACILITATOR,
    ADMIN;

    public boolean canEditSchedule() {
        return this == FACILITATOR || this == ADMIN;
    }

    public static Optional<CallerRole> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        if (normalized.startsWith("ROLE_")) {
            normalized = normalized.substring("ROLE_".length());
        }
        try {
            return Optional.of(CallerRole.valueOf(normalized));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }

    /**
     * Highest role among the given codes; unknown codes are ignored and an empty set yields {@link #VIEWER}.
     */
    public static CallerRole highestOf(Collection<String> codes) {
        CallerRole highest = VIEWER;
        for (String code : codes) {
            CallerRole role = fromCode(code).orElse(VIEWER);
            if (role.ordinal() > highest.ordinal()) {
                highest = role;
            }
        }
        return highest;
    }
}
