package com.bank.fraud.model;

import java.util.Locale;

/**
 * Money flow direction relative to the monitored account.
 * CREDIT is inbound, DEBIT is outbound.
 */
public enum Direction {
    CREDIT,
    DEBIT;

    public static Direction fromString(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return Direction.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
