package com.example.routing.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Ordered risk scale. Declaration order is the severity order, so
 * {@code compareTo} and {@link #elevate()} / {@link #reduce()} rely on it.
 */
public enum RiskLevel {
    LOW("low", 0.25),
    MEDIUM("medium", 0.5),
    HIGH("high", 0.75),
    CRITICAL("critical", 1.0);

    private final String value;
    private final double baseScore;

    RiskLevel(String value, double baseScore) {
        this.value = value;
        this.baseScore = baseScore;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public double baseScore() {
        return baseScore;
    }

    /** One step up; CRITICAL stays CRITICAL. */
    public RiskLevel elevate() {
        return this == CRITICAL ? CRITICAL : values()[ordinal() + 1];
    }

    /** One step down; LOW stays LOW. */
    public RiskLevel reduce() {
        return this == LOW ? LOW : values()[ordinal() - 1];
    }

    public boolean atLeast(RiskLevel other) {
        return compareTo(other) >= 0;
    }

    public static RiskLevel max(RiskLevel a, RiskLevel b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    @JsonCreator
    public static RiskLevel fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return MEDIUM;
        }
        String normalized = raw.strip().toLowerCase(Locale.ROOT);
        for (RiskLevel level : values()) {
            if (level.value.equals(normalized)) {
                return level;
            }
        }
        return MEDIUM;
    }
}
