package com.bank.fraud.model;

public enum Decision {
    AUTO_APPROVE,
    MANUAL_REVIEW,
    BLOCKED
}
