package dev.resumescreener.model;

import java.util.Locale;

/**
 * Categorical grade of how well a passage demonstrates a skill.
 */
public enum EvidenceStrength {
    NONE(0.0),
    WEAK(0.4),
    MODERATE(0.7),
    STRONG(1.0);

    private final double value;

    EvidenceStrength(double value) {
        this.value = value;
    }

    public double value() {
        return value;
    }

    /**
     * Parse an oracle label. Returns null for labels outside the four known grades.
     */
    public static EvidenceStrength fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return null;
        }
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "none" -> NONE;
            case "weak" -> WEAK;
            case "moderate" -> MODERATE;
            case "strong" -> STRONG;
            default -> null;
        };
    }
}
