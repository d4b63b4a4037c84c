package dev.resumescreener.model;

import java.util.Locale;

public enum Importance {
    CRITICAL,
    REQUIRED,
    NICE_TO_HAVE;

    public boolean isCore() {
        return this == CRITICAL || this == REQUIRED;
    }

    /**
     * Lenient parse of the oracle's importance labels. Only "critical" and "required" are
     * recognized; "preferred", unknown and missing labels mean {@code defaultValue}, the
     * importance of the list the skill was listed in.
     */
    public static Importance fromLabel(String label, Importance defaultValue) {
        if (label == null || label.isBlank()) {
            return defaultValue;
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return switch (normalized) {
            case "critical" -> CRITICAL;
            case "required" -> REQUIRED;
            default -> defaultValue;
        };
    }
}
