package com.bank.fraud.model;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static RiskLevel fromScore(double score) {
        if (score >= 0.8) return CRITICAL;
        if (score >= 0.6) return HIGH;
        if (score >= 0.3) return MEDIUM;
        return LOW;
    }
}
