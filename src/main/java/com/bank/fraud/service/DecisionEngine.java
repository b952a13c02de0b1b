package com.bank.fraud.service;

import com.bank.fraud.config.MonitoringConfig;
import com.bank.fraud.model.AssessmentResult;
import com.bank.fraud.model.Decision;
import com.bank.fraud.model.ReviewStatus;
import com.bank.fraud.model.RiskLevel;
import com.bank.fraud.model.Transaction;
import com.bank.fraud.model.TriggeredRule;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Maps a score and its triggered rules to a decision and builds the assessment.
 *
 * A hard-override rule blocks regardless of score. Otherwise the manual review threshold
 * splits MANUAL_REVIEW from AUTO_APPROVE.
 */
@Service
public class DecisionEngine {

    private final double manualReviewThreshold;
    private final Clock clock;

    public DecisionEngine(MonitoringConfig config, Clock clock) {
        this.manualReviewThreshold = config.getManualReviewThreshold();
        this.clock = clock;
    }

    public AssessmentResult decide(double score, List<TriggeredRule> triggered, Transaction txn,
                                   String scoringVersion) {
        Decision decision = decision(score, triggered);

        return AssessmentResult.builder()
                .assessmentId(assessmentId(txn.getTransactionId()))
                .transactionId(txn.getTransactionId())
                .accountId(txn.getAccountId())
                .riskScore(score)
                .riskLevel(RiskLevel.fromScore(score))
                .decision(decision)
                .reviewStatus(decision == Decision.AUTO_APPROVE ? ReviewStatus.APPROVED : ReviewStatus.PENDING)
                .triggeredRules(List.copyOf(triggered))
                .scoringVersion(scoringVersion)
                .createdAt(Instant.now(clock))
                .build();
    }

    public Decision decision(double score, List<TriggeredRule> triggered) {
        if (triggered.stream().anyMatch(TriggeredRule::isHardOverride)) {
            return Decision.BLOCKED;
        }
        if (score >= manualReviewThreshold) {
            return Decision.MANUAL_REVIEW;
        }
        return Decision.AUTO_APPROVE;
    }

    /**
     * Same transaction, same id: a retried evaluation addresses the record already written.
     */
    static String assessmentId(String transactionId) {
        return UUID.nameUUIDFromBytes(("assessment:" + transactionId).getBytes(StandardCharsets.UTF_8)).toString();
    }
}
