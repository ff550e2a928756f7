package com.quotaguard.backend.entity;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum Tier {
    FREE("free"),
    STARTER("starter"),
    PRO("pro"),
    TEAM("team"),
    ENTERPRISE("enterprise");

    private final String code;

    Tier(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<Tier> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(tier -> tier.code.equals(normalized))
                .findFirst();
    }
}
