package com.bank.fraud.service;

import com.bank.fraud.config.MetricsConfig;
import com.bank.fraud.config.MonitoringConfig;
import com.bank.fraud.context.Context;
import com.bank.fraud.context.ContextAssembler;
import com.bank.fraud.engine.RuleEvaluator;
import com.bank.fraud.exception.AssessmentPersistenceException;
import com.bank.fraud.exception.InvalidTransactionException;
import com.bank.fraud.exception.LedgerUnavailableException;
import com.bank.fraud.model.AssessmentResult;
import com.bank.fraud.model.Decision;
import com.bank.fraud.model.Transaction;
import com.bank.fraud.repository.AssessmentRepository;
import com.bank.fraud.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.bank.fraud.testutil.TestDataFactory.createTriggeredRule;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TransactionMonitorTest {

    @Mock private ContextAssembler contextAssembler;
    @Mock private RuleEvaluator ruleEvaluator;
    @Mock private AssessmentRepository assessmentRepository;
    @Mock private MetricsConfig metricsConfig;

    private TransactionMonitor monitor;
    private Transaction txn;

    @BeforeEach
    void setUp() {
        MonitoringConfig config = new MonitoringConfig();
        monitor = new TransactionMonitor(contextAssembler, ruleEvaluator, new RiskScorer(config),
                new DecisionEngine(config, Clock.fixed(TestDataFactory.NOW, ZoneOffset.UTC)),
                assessmentRepository, metricsConfig);
        txn = TestDataFactory.debit("TXN-1", "ACC-1", 45_000, TestDataFactory.NOW);
    }

    @Test
    void evaluate_fullPipeline_persistsAssessment() {
        Context context = Context.of(Map.of("beneficiary.is_new_beneficiary", true));
        when(assessmentRepository.findByTransactionId("TXN-1")).thenReturn(Optional.empty());
        when(contextAssembler.build(txn)).thenReturn(context);
        when(ruleEvaluator.run(txn, context)).thenReturn(List.of(
                createTriggeredRule("core.large_amount", 2.0),
                createTriggeredRule("beneficiary.payment_to_new_beneficiary", 3.0),
                createTriggeredRule("beneficiary.high_value_to_new_beneficiary", 3.0)));
        when(assessmentRepository.insertOnce(any(AssessmentResult.class))).thenAnswer(inv -> inv.getArgument(0));

        AssessmentResult result = monitor.evaluate(txn);

        assertThat(result.getRiskScore()).isEqualTo(0.8);
        assertThat(result.getDecision()).isEqualTo(Decision.MANUAL_REVIEW);
        assertThat(result.getTriggeredRules()).hasSize(3);
        assertThat(result.getScoringVersion()).isEqualTo("sum-v1/K=10.0");

        ArgumentCaptor<AssessmentResult> saved = ArgumentCaptor.forClass(AssessmentResult.class);
        verify(assessmentRepository).insertOnce(saved.capture());
        assertThat(saved.getValue().getTransactionId()).isEqualTo("TXN-1");
        verify(metricsConfig).recordEvaluation("MANUAL_REVIEW", 0.8);
    }

    @Test
    void evaluate_alreadyAssessed_returnsStoredResultWithoutReevaluating() {
        AssessmentResult stored = AssessmentResult.builder()
                .transactionId("TXN-1").decision(Decision.AUTO_APPROVE).riskScore(0.1).build();
        when(assessmentRepository.findByTransactionId("TXN-1")).thenReturn(Optional.of(stored));

        AssessmentResult result = monitor.evaluate(txn);

        assertThat(result).isSameAs(stored);
        verifyNoInteractions(contextAssembler, ruleEvaluator);
        verify(assessmentRepository, never()).insertOnce(any());
    }

    @Test
    void evaluate_concurrentDuplicate_returnsRecordAlreadyStored() {
        AssessmentResult winner = AssessmentResult.builder()
                .transactionId("TXN-1").decision(Decision.MANUAL_REVIEW).riskScore(0.7)
                .triggeredRules(List.of(createTriggeredRule("core.large_amount", 2.0))).build();
        when(assessmentRepository.findByTransactionId("TXN-1")).thenReturn(Optional.empty());
        when(contextAssembler.build(txn)).thenReturn(Context.empty());
        when(ruleEvaluator.run(eq(txn), any())).thenReturn(List.of());
        when(assessmentRepository.insertOnce(any(AssessmentResult.class))).thenReturn(winner);

        assertThat(monitor.evaluate(txn)).isSameAs(winner);
        verify(metricsConfig).recordEvaluation("MANUAL_REVIEW", 0.7);
    }

    @Test
    void evaluate_ledgerUnavailable_nothingPersisted() {
        when(assessmentRepository.findByTransactionId("TXN-1")).thenReturn(Optional.empty());
        when(contextAssembler.build(txn)).thenThrow(new LedgerUnavailableException("down", null));

        assertThatThrownBy(() -> monitor.evaluate(txn)).isInstanceOf(LedgerUnavailableException.class);

        verify(assessmentRepository, never()).insertOnce(any());
        verify(metricsConfig).recordEvaluationFailure("ledger_unavailable");
    }

    @Test
    void evaluate_persistenceFailure_propagates() {
        when(assessmentRepository.findByTransactionId("TXN-1")).thenReturn(Optional.empty());
        when(contextAssembler.build(txn)).thenReturn(Context.empty());
        when(ruleEvaluator.run(eq(txn), any())).thenReturn(List.of());
        when(assessmentRepository.insertOnce(any(AssessmentResult.class)))
                .thenThrow(new AssessmentPersistenceException("write failed", null));

        assertThatThrownBy(() -> monitor.evaluate(txn)).isInstanceOf(AssessmentPersistenceException.class);

        verify(metricsConfig, never()).recordEvaluation(anyString(), org.mockito.ArgumentMatchers.anyDouble());
        verify(metricsConfig).recordEvaluationFailure("persistence");
    }

    @Test
    void evaluate_missingAccountId_rejectedBeforeAnyLookup() {
        Transaction invalid = txn.toBuilder().accountId(null).build();

        assertThatThrownBy(() -> monitor.evaluate(invalid))
                .isInstanceOf(InvalidTransactionException.class)
                .hasMessageContaining("accountId");

        verifyNoInteractions(assessmentRepository, contextAssembler, ruleEvaluator);
    }

    @Test
    void evaluate_negativeOrNaNAmount_rejected() {
        assertThatThrownBy(() -> monitor.evaluate(txn.toBuilder().amount(-1).build()))
                .isInstanceOf(InvalidTransactionException.class);
        assertThatThrownBy(() -> monitor.evaluate(txn.toBuilder().amount(Double.NaN).build()))
                .isInstanceOf(InvalidTransactionException.class);

        verifyNoInteractions(assessmentRepository);
    }

    @Test
    void evaluate_missingDirectionOrTimestamp_rejected() {
        assertThatThrownBy(() -> monitor.evaluate(txn.toBuilder().direction(null).build()))
                .isInstanceOf(InvalidTransactionException.class);
        assertThatThrownBy(() -> monitor.evaluate(txn.toBuilder().timestamp(null).build()))
                .isInstanceOf(InvalidTransactionException.class);
    }
}
