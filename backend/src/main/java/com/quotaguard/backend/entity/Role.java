package com.quotaguard.backend.entity;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Principal roles, declared from least to most privileged.
 */
public enum Role {
    USER("user"),
    SUPPORT("support"),
    ADMIN("admin"),
    SUPER_ADMIN("super_admin");

    private final String code;

    Role(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public String authority() {
        return "ROLE_" + name();
    }

    public boolean isAtLeast(Role other) {
        return ordinal() >= other.ordinal();
    }

    public static Optional<Role> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(role -> role.code.equals(normalized))
                .findFirst();
    }
}
