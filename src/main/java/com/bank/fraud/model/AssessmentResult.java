package com.bank.fraud.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Persisted outcome of evaluating one transaction.
 *
 * Everything except the review fields (reviewStatus, reviewNotes, reviewerId, reviewedAt)
 * is fixed at creation. The review fields are changed later by the analyst workflow.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssessmentResult {
    private String assessmentId;
    private String transactionId;
    private String accountId;
    private double riskScore;
    private RiskLevel riskLevel;
    private Decision decision;
    private ReviewStatus reviewStatus;
    private List<TriggeredRule> triggeredRules;
    private String scoringVersion;
    private Instant createdAt;

    private String reviewNotes;
    private String reviewerId;
    private Instant reviewedAt;
}
