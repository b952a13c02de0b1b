package com.bank.fraud.service;

import com.bank.fraud.config.MonitoringConfig;
import com.bank.fraud.model.AssessmentResult;
import com.bank.fraud.model.Decision;
import com.bank.fraud.model.ReviewStatus;
import com.bank.fraud.model.RiskLevel;
import com.bank.fraud.model.Transaction;
import com.bank.fraud.model.TriggeredRule;
import com.bank.fraud.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;

import static com.bank.fraud.testutil.TestDataFactory.createBlockingRule;
import static com.bank.fraud.testutil.TestDataFactory.createTriggeredRule;
import static org.assertj.core.api.Assertions.assertThat;

class DecisionEngineTest {

    private DecisionEngine engine;
    private Transaction txn;

    @BeforeEach
    void setUp() {
        engine = new DecisionEngine(new MonitoringConfig(), Clock.fixed(TestDataFactory.NOW, ZoneOffset.UTC));
        txn = TestDataFactory.debit("TXN-1", "ACC-1", 500.0, TestDataFactory.NOW);
    }

    @Test
    void decide_noRules_autoApproved() {
        AssessmentResult result = engine.decide(0.0, Collections.emptyList(), txn, "sum-v1/K=10.0");

        assertThat(result.getDecision()).isEqualTo(Decision.AUTO_APPROVE);
        assertThat(result.getReviewStatus()).isEqualTo(ReviewStatus.APPROVED);
        assertThat(result.getRiskLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(result.getTriggeredRules()).isEmpty();
        assertThat(result.getCreatedAt()).isEqualTo(TestDataFactory.NOW);
        assertThat(result.getScoringVersion()).isEqualTo("sum-v1/K=10.0");
    }

    @Test
    void decide_scoreAtThreshold_manualReview() {
        List<TriggeredRule> rules = List.of(createTriggeredRule("a", 6.0));

        AssessmentResult result = engine.decide(0.6, rules, txn, "v");

        assertThat(result.getDecision()).isEqualTo(Decision.MANUAL_REVIEW);
        assertThat(result.getReviewStatus()).isEqualTo(ReviewStatus.PENDING);
        assertThat(result.getRiskLevel()).isEqualTo(RiskLevel.HIGH);
    }

    @Test
    void decide_scoreJustBelowThreshold_autoApproved() {
        AssessmentResult result = engine.decide(0.59, List.of(createTriggeredRule("a", 5.9)), txn, "v");

        assertThat(result.getDecision()).isEqualTo(Decision.AUTO_APPROVE);
        assertThat(result.getRiskLevel()).isEqualTo(RiskLevel.MEDIUM);
    }

    @Test
    void decide_hardOverride_blockedWhateverTheScore() {
        List<TriggeredRule> rules = List.of(createBlockingRule("device.blacklisted_entity", 0.5));

        AssessmentResult result = engine.decide(0.05, rules, txn, "v");

        assertThat(result.getDecision()).isEqualTo(Decision.BLOCKED);
        assertThat(result.getReviewStatus()).isEqualTo(ReviewStatus.PENDING);
        assertThat(result.getRiskLevel()).isEqualTo(RiskLevel.LOW);
    }

    @Test
    void decide_sameTransaction_sameAssessmentId() {
        AssessmentResult first = engine.decide(0.2, Collections.emptyList(), txn, "v");
        AssessmentResult second = engine.decide(0.2, Collections.emptyList(), txn, "v");
        Transaction other = TestDataFactory.debit("TXN-2", "ACC-1", 500.0, TestDataFactory.NOW);

        assertThat(first.getAssessmentId()).isEqualTo(second.getAssessmentId());
        assertThat(engine.decide(0.2, Collections.emptyList(), other, "v").getAssessmentId())
                .isNotEqualTo(first.getAssessmentId());
    }

    @Test
    void decide_customThreshold_respected() {
        MonitoringConfig config = new MonitoringConfig();
        config.setManualReviewThreshold(0.3);
        DecisionEngine strict = new DecisionEngine(config, Clock.systemUTC());

        assertThat(strict.decision(0.35, List.of(createTriggeredRule("a", 3.5)))).isEqualTo(Decision.MANUAL_REVIEW);
    }

    @Test
    void riskLevel_bands() {
        assertThat(RiskLevel.fromScore(0.29)).isEqualTo(RiskLevel.LOW);
        assertThat(RiskLevel.fromScore(0.3)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(RiskLevel.fromScore(0.6)).isEqualTo(RiskLevel.HIGH);
        assertThat(RiskLevel.fromScore(0.8)).isEqualTo(RiskLevel.CRITICAL);
        assertThat(RiskLevel.fromScore(1.0)).isEqualTo(RiskLevel.CRITICAL);
    }
}
