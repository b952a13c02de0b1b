package com.bank.fraud.model;

/**
 * Analyst review state of an assessment. Only PENDING assessments may be moved
 * to another state by the reviewing process.
 */
public enum ReviewStatus {
    PENDING,
    APPROVED,
    REJECTED,
    ESCALATED
}
