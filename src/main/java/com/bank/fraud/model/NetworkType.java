package com.bank.fraud.model;

import java.util.Locale;

public enum NetworkType {
    VPN,
    PROXY,
    TOR,
    DATACENTER;

    public static NetworkType fromString(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return NetworkType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
