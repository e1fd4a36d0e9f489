package io.devguard.model;

import java.util.Locale;

/**
 * Severity of an integrity finding.
 */
public enum Severity {
    HIGH(1, "HIGH"),
    MEDIUM(2, "MEDIUM"),
    LOW(3, "LOW");

    private final int rank;
    private final String label;

    Severity(int rank, String label) {
        this.rank = rank;
        this.label = label;
    }

    public int rank() {
        return rank;
    }

    public String label() {
        return label;
    }

    /**
     * Returns true if this severity is at least as severe as the given threshold.
     */
    public boolean isAtLeast(Severity threshold) {
        return this.rank <= threshold.rank;
    }

    public static Severity parse(String value) {
        try {
            return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Unknown severity: " + value + " (expected high, medium or low)");
        }
    }
}
