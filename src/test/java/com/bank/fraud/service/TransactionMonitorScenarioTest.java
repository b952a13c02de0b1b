package com.bank.fraud.service;

import com.bank.fraud.config.MetricsConfig;
import com.bank.fraud.config.MonitoringConfig;
import com.bank.fraud.context.ContextAssembler;
import com.bank.fraud.context.SignalGroup;
import com.bank.fraud.context.signals.AccountAgeSignals;
import com.bank.fraud.context.signals.AccountTakeoverSignals;
import com.bank.fraud.context.signals.BehavioralSignals;
import com.bank.fraud.context.signals.BeneficiarySignals;
import com.bank.fraud.context.signals.BlacklistSignals;
import com.bank.fraud.context.signals.CheckDepositSignals;
import com.bank.fraud.context.signals.DeviceSignals;
import com.bank.fraud.context.signals.FraudHistorySignals;
import com.bank.fraud.context.signals.GeolocationSignals;
import com.bank.fraud.context.signals.MoneyMuleSignals;
import com.bank.fraud.context.signals.NetworkSignals;
import com.bank.fraud.context.signals.OddHoursSignals;
import com.bank.fraud.context.signals.RelationshipSignals;
import com.bank.fraud.context.signals.VelocitySignals;
import com.bank.fraud.engine.RuleCatalog;
import com.bank.fraud.engine.RuleEvaluator;
import com.bank.fraud.engine.RuleSet;
import com.bank.fraud.engine.rules.AccountTakeoverRules;
import com.bank.fraud.engine.rules.BeneficiaryRules;
import com.bank.fraud.engine.rules.CheckFraudRules;
import com.bank.fraud.engine.rules.CoreRules;
import com.bank.fraud.engine.rules.DeviceRules;
import com.bank.fraud.engine.rules.GeolocationRules;
import com.bank.fraud.engine.rules.HistoryRules;
import com.bank.fraud.engine.rules.MoneyMuleRules;
import com.bank.fraud.engine.rules.PayrollRules;
import com.bank.fraud.engine.rules.TimingRules;
import com.bank.fraud.engine.rules.VendorPaymentRules;
import com.bank.fraud.ledger.ReferenceDataCache;
import com.bank.fraud.model.AssessmentResult;
import com.bank.fraud.model.Beneficiary;
import com.bank.fraud.model.BlacklistEntry;
import com.bank.fraud.model.Decision;
import com.bank.fraud.model.ReviewStatus;
import com.bank.fraud.model.Severity;
import com.bank.fraud.model.Transaction;
import com.bank.fraud.model.TriggeredRule;
import com.bank.fraud.repository.AssessmentRepository;
import com.bank.fraud.testutil.InMemoryTransactionLedger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import static com.bank.fraud.testutil.TestDataFactory.NOW;
import static com.bank.fraud.testutil.TestDataFactory.createAccount;
import static com.bank.fraud.testutil.TestDataFactory.credit;
import static com.bank.fraud.testutil.TestDataFactory.daysAgo;
import static com.bank.fraud.testutil.TestDataFactory.debit;
import static com.bank.fraud.testutil.TestDataFactory.hoursAgo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

/**
 * Runs the real signal groups and rule sets against an in-memory ledger; only storage is mocked.
 */
@ExtendWith(MockitoExtension.class)
class TransactionMonitorScenarioTest {

    @Mock private AssessmentRepository assessmentRepository;

    private InMemoryTransactionLedger ledger;
    private ReferenceDataCache referenceData;
    private ExecutorService executor;
    private TransactionMonitor monitor;

    @BeforeEach
    void setUp() {
        MonitoringConfig config = new MonitoringConfig();
        MetricsConfig metrics = new MetricsConfig(new SimpleMeterRegistry());
        ledger = new InMemoryTransactionLedger();
        executor = Executors.newFixedThreadPool(4);

        referenceData = new ReferenceDataCache(ledger);
        List<SignalGroup> groups = List.of(
                new AccountAgeSignals(ledger, config),
                new AccountTakeoverSignals(ledger, config),
                new BehavioralSignals(ledger, config),
                new BeneficiarySignals(ledger, config),
                new BlacklistSignals(referenceData),
                new CheckDepositSignals(ledger, config),
                new DeviceSignals(ledger, config),
                new FraudHistorySignals(ledger, config),
                new GeolocationSignals(ledger, referenceData, config),
                new MoneyMuleSignals(ledger, config),
                new NetworkSignals(referenceData),
                new OddHoursSignals(ledger, config),
                new RelationshipSignals(ledger, config),
                new VelocitySignals(ledger, config));
        List<RuleSet> sets = List.of(
                new CoreRules(config), new MoneyMuleRules(config), new BeneficiaryRules(config),
                new VendorPaymentRules(config), new PayrollRules(config), new AccountTakeoverRules(config),
                new TimingRules(config), new GeolocationRules(config), new DeviceRules(config),
                new HistoryRules(config), new CheckFraudRules());

        monitor = new TransactionMonitor(
                new ContextAssembler(groups, config, executor, metrics),
                new RuleEvaluator(RuleCatalog.compose(sets), metrics),
                new RiskScorer(config),
                new DecisionEngine(config, Clock.fixed(NOW, ZoneOffset.UTC)),
                assessmentRepository, metrics);

        when(assessmentRepository.findByTransactionId(anyString())).thenReturn(Optional.empty());
        when(assessmentRepository.insertOnce(any(AssessmentResult.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static List<String> ruleNames(AssessmentResult result) {
        return result.getTriggeredRules().stream().map(TriggeredRule::getRuleName).collect(Collectors.toList());
    }

    private static void assertScoreMatchesRules(AssessmentResult result) {
        double sum = result.getTriggeredRules().stream().mapToDouble(TriggeredRule::getWeight).sum();
        assertThat(result.getRiskScore()).isCloseTo(Math.min(sum / 10.0, 1.0), within(1e-9));
    }

    @Test
    void largeTransferFromBrandNewAccount_flaggedForReview() {
        ledger.account(createAccount("ACC-NEW", hoursAgo(3)));
        referenceData.refresh();

        AssessmentResult result = monitor.evaluate(debit("TXN-1", "ACC-NEW", 50_000, NOW));

        assertThat(ruleNames(result)).contains("core.large_amount",
                "history.brand_new_account_large_transaction", "history.critical_account_age");
        assertScoreMatchesRules(result);
        assertThat(result.getRiskScore()).isGreaterThanOrEqualTo(0.85);
        assertThat(result.getDecision()).isIn(Decision.MANUAL_REVIEW, Decision.BLOCKED);
        assertThat(result.getReviewStatus()).isEqualTo(ReviewStatus.PENDING);
    }

    @Test
    void largePaymentToBeneficiaryAddedTwoHoursAgo_flaggedForReview() {
        ledger.account(createAccount("ACC-5", daysAgo(2_000)))
                .beneficiary(Beneficiary.builder().beneficiaryId("BEN-9").accountId("ACC-5")
                        .counterpartyId("CP-9").name("New Payee").addedAt(hoursAgo(2)).build());
        referenceData.refresh();

        AssessmentResult result = monitor.evaluate(
                debit("TXN-5", "ACC-5", 45_000, NOW).toBuilder().counterpartyId("CP-9").build());

        assertThat(ruleNames(result)).contains("beneficiary.payment_to_new_beneficiary",
                "beneficiary.high_value_to_new_beneficiary", "core.large_amount");
        assertScoreMatchesRules(result);
        assertThat(result.getRiskScore()).isGreaterThanOrEqualTo(0.8);
        assertThat(result.getDecision()).isIn(Decision.MANUAL_REVIEW, Decision.BLOCKED);
    }

    @Test
    void unreadableHistoricalMetadata_skippedAndEvaluationCompletes() {
        String newYork = "{\"geo\": {\"country\": \"US\", \"city\": \"New York\", "
                + "\"latitude\": 40.7128, \"longitude\": -74.0060}}";
        String london = "{\"geo\": {\"country\": \"GB\", \"city\": \"London\", "
                + "\"latitude\": 51.5074, \"longitude\": -0.1278}}";
        ledger.account(createAccount("ACC-6", daysAgo(2_000)))
                .transaction(debit("H-1", "ACC-6", 60, hoursAgo(2)).toBuilder().metadata(newYork).build())
                .transaction(debit("H-2", "ACC-6", 70, hoursAgo(1)).toBuilder().metadata("{not json").build());
        referenceData.refresh();

        AssessmentResult result = monitor.evaluate(
                debit("TXN-6", "ACC-6", 80, NOW).toBuilder().metadata(london).build());

        assertThat(result.getTransactionId()).isEqualTo("TXN-6");
        assertThat(ruleNames(result)).contains("geo.impossible_travel");
        assertScoreMatchesRules(result);
    }

    @Test
    void blacklistedIp_blockedRegardlessOfScore() {
        ledger.account(createAccount("ACC-1", daysAgo(2_000)))
                .blacklistEntry(BlacklistEntry.builder().entryId("BL-1").entityType("ip")
                        .entityValue("203.0.113.50").severity(Severity.CRITICAL).active(true)
                        .addedAt(daysAgo(30)).build());
        referenceData.refresh();

        Transaction txn = debit("TXN-2", "ACC-1", 80, NOW).toBuilder()
                .metadata("{\"ip_address\": \"203.0.113.50\"}").build();
        AssessmentResult result = monitor.evaluate(txn);

        assertThat(result.getDecision()).isEqualTo(Decision.BLOCKED);
        assertThat(result.getReviewStatus()).isEqualTo(ReviewStatus.PENDING);
        assertThat(ruleNames(result)).contains("device.blacklisted_entity");
        assertScoreMatchesRules(result);
    }

    @Test
    void secondPresentmentOfSameCheck_triggersDuplicateCheck() {
        String check = "{\"check\": {\"check_number\": \"1001\", \"check_amount\": 500}}";
        ledger.account(createAccount("ACC-2", daysAgo(2_000)))
                .transaction(credit("DEP-1", "ACC-2", 500, daysAgo(3)).toBuilder().metadata(check).build());
        referenceData.refresh();

        AssessmentResult result = monitor.evaluate(
                credit("DEP-2", "ACC-2", 500, NOW).toBuilder().metadata(check).build());

        assertThat(ruleNames(result)).contains("check.duplicate_check")
                .doesNotContain("check.check_number_reused");
        assertScoreMatchesRules(result);
    }

    @Test
    void routinePaymentFromEstablishedAccount_autoApproved() {
        ledger.account(createAccount("ACC-3", daysAgo(2_000)));
        double[] amounts = {42, 55, 48, 61, 39, 52, 47, 58};
        for (int i = 0; i < amounts.length; i++) {
            ledger.transaction(debit("H-" + i, "ACC-3", amounts[i], daysAgo(7 * (i + 1))));
        }
        referenceData.refresh();

        AssessmentResult result = monitor.evaluate(debit("TXN-3", "ACC-3", 50, NOW));

        assertThat(result.getDecision()).isEqualTo(Decision.AUTO_APPROVE);
        assertThat(result.getReviewStatus()).isEqualTo(ReviewStatus.APPROVED);
        assertThat(result.getRiskScore()).isLessThan(0.6);
    }

    @Test
    void sameInputTwice_sameAssessment() {
        ledger.account(createAccount("ACC-4", daysAgo(20)));
        referenceData.refresh();
        Transaction txn = debit("TXN-4", "ACC-4", 12_000, NOW);

        AssessmentResult first = monitor.evaluate(txn);
        AssessmentResult second = monitor.evaluate(txn);

        assertThat(second.getAssessmentId()).isEqualTo(first.getAssessmentId());
        assertThat(second.getRiskScore()).isEqualTo(first.getRiskScore());
        assertThat(second.getDecision()).isEqualTo(first.getDecision());
        assertThat(ruleNames(second)).isEqualTo(ruleNames(first));
    }
}
