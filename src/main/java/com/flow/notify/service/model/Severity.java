package com.flow.notify.service.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of a notification event, ordered from most to least severe.
 */
public enum Severity {

    CRITICAL(4),
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    /**
     * Returns true if this severity is strictly more severe than {@code other}.
     */
    public boolean isHigherThan(Severity other) {
        return other == null || rank > other.rank;
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromJson(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
