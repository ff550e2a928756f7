package com.quotaguard.backend.audit;

import java.util.Map;

/**
 * Who changed a principal and why, as recorded next to every captured field change.
 */
public record ChangeAttribution(Long actorId, String reason, Map<String, Object> metadata) {

    public static final String DEFAULT_REASON = "Automatic change capture";

    public ChangeAttribution {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static ChangeAttribution of(Long actorId, String reason) {
        return new ChangeAttribution(actorId, reason, Map.of());
    }

    public static ChangeAttribution system(String reason, String trigger) {
        return new ChangeAttribution(null, reason, Map.of("trigger", trigger));
    }

    public String reasonOrDefault() {
        return reason == null || reason.isBlank() ? DEFAULT_REASON : reason;
    }
}
