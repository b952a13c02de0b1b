package com.bank.fraud.model;

import java.util.Locale;

public enum Severity {
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    CRITICAL(4);

    private final int score;

    Severity(int score) {
        this.score = score;
    }

    public int getScore() {
        return score;
    }

    /**
     * Lenient parse used when mapping ledger records. Unknown values map to null.
     */
    public static Severity fromString(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public static Severity max(Severity a, Severity b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.score >= b.score ? a : b;
    }
}
