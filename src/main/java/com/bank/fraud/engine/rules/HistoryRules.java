package com.bank.fraud.engine.rules;

import com.bank.fraud.config.MonitoringConfig;
import com.bank.fraud.engine.Rule;
import com.bank.fraud.engine.RuleSet;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Account maturity, prior fraud and counterparty relationship rules.
 */
@Component
public class HistoryRules implements RuleSet {

    private final List<Rule> rules;

    public HistoryRules(MonitoringConfig config) {
        MonitoringConfig.RuleThresholds t = config.getRules();
        MonitoringConfig.Signals s = config.getSignals();

        this.rules = List.of(
                Rule.of("brand_new_account_large_transaction", "account-age", 4.0,
                        String.format("Transaction of $%,.2f+ on an account less than %d day(s) old",
                                t.getLargeAmount(), s.getBrandNewAccountDays()),
                        (txn, ctx) -> ctx.isTrue("account.is_brand_new_account") && txn.getAmount() >= t.getLargeAmount()),

                Rule.of("critical_account_age", "account-age", 2.5,
                        String.format("Account less than %d days old", s.getCriticalAccountAgeDays()),
                        (txn, ctx) -> ctx.textEquals("account.account_age_risk_level", "critical")),

                Rule.of("high_risk_account_age", "account-age", 1.5,
                        String.format("Account less than %d days old", s.getHighRiskAccountAgeDays()),
                        (txn, ctx) -> ctx.textEquals("account.account_age_risk_level", "high")),

                Rule.of("large_transaction_young_account", "account-age", 2.0,
                        String.format("Transaction of $%,.2f+ on an account less than %d days old",
                                s.getLargeTransactionAmount(), s.getYoungAccountDays()),
                        (txn, ctx) -> ctx.isTrue("account.is_large_tx_young_account")),

                Rule.of("account_prior_fraud", "fraud-history", 2.0,
                        "Account has prior fraud flags",
                        (txn, ctx) -> ctx.atLeast("history.account_prior_fraud_count", 1)),

                Rule.of("counterparty_confirmed_fraud", "fraud-history", 3.0,
                        "Counterparty has confirmed fraud on record",
                        (txn, ctx) -> ctx.atLeast("history.counterparty_confirmed_count", 1)),

                Rule.of("repeat_offender", "fraud-history", 2.5,
                        String.format("Account or counterparty flagged %d+ times", s.getRepeatOffenderCount()),
                        (txn, ctx) -> ctx.isTrue("history.account_is_repeat_offender")
                                || ctx.isTrue("history.counterparty_is_repeat_offender")),

                Rule.of("escalating_fraud_severity", "fraud-history", 1.5,
                        "Recent fraud flags are more severe than older ones",
                        (txn, ctx) -> ctx.isTrue("history.account_escalating_severity")
                                || ctx.isTrue("history.counterparty_escalating_severity")),

                Rule.of("low_trust_counterparty", "relationship", 1.0,
                        String.format("Outbound payment to a counterparty with trust score below %.0f", t.getMinTrustScore()),
                        (txn, ctx) -> txn.isOutbound() && ctx.below("relationship.trust_score", t.getMinTrustScore())),

                Rule.of("dormant_relationship_reactivation", "relationship", 2.0,
                        String.format("Payment to a counterparty dormant for %d+ days", s.getRelationshipDormantDays()),
                        (txn, ctx) -> txn.isOutbound() && ctx.isTrue("relationship.is_dormant_reactivation"))
        );
    }

    @Override
    public String prefix() {
        return "history";
    }

    @Override
    public List<Rule> rules() {
        return rules;
    }
}
