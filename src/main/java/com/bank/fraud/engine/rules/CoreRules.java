package com.bank.fraud.engine.rules;

import com.bank.fraud.config.MonitoringConfig;
import com.bank.fraud.context.Context;
import com.bank.fraud.engine.Rule;
import com.bank.fraud.engine.RuleSet;
import com.bank.fraud.model.Transaction;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Amount, velocity and history rules that apply to every account.
 */
@Component
public class CoreRules implements RuleSet {

    static final String CATEGORY = "transaction-pattern";

    private final List<Rule> rules;

    public CoreRules(MonitoringConfig config) {
        MonitoringConfig.RuleThresholds t = config.getRules();

        this.rules = List.of(
                Rule.of("large_amount", CATEGORY, 2.0,
                        String.format("Transaction amount exceeds $%,.2f", t.getLargeAmount()),
                        (txn, ctx) -> txn.getAmount() > t.getLargeAmount()),

                Rule.of("high_velocity_1h", "velocity", 1.5,
                        String.format("%d or more transactions in the last hour", t.getVelocityCount1h()),
                        (txn, ctx) -> ctx.atLeast("velocity.tx_count_1h", t.getVelocityCount1h())),

                Rule.of("high_velocity_24h", "velocity", 1.5,
                        String.format("%d or more transactions in the last 24 hours", t.getVelocityCount24h()),
                        (txn, ctx) -> ctx.atLeast("velocity.tx_count_24h", t.getVelocityCount24h())),

                Rule.of("small_deposit_burst", "velocity", 2.0,
                        String.format("%d or more small inbound deposits in 24 hours", t.getSmallDepositCount24h()),
                        (txn, ctx) -> ctx.atLeast("velocity.small_deposit_count_24h", t.getSmallDepositCount24h())),

                Rule.of("amount_deviation", CATEGORY, 1.5,
                        String.format("Amount deviates %.1f+ sigma from this transaction type's history",
                                t.getAmountDeviationSigma()),
                        (txn, ctx) -> ctx.atLeast("velocity.amount_deviation", t.getAmountDeviationSigma())),

                Rule.of("low_activity_large_transfer", CATEGORY, 2.0,
                        String.format("Large transfer ($%,.2f+, %.1fx avg) from low-activity account (<=%d tx in period)",
                                t.getLowActivityMinAmount(), t.getLowActivityMultiplier(), t.getLowActivityCount()),
                        (txn, ctx) -> isLowActivityLargeTransfer(txn, ctx, t)),

                Rule.of("small_test_then_large_withdrawal", CATEGORY, 3.0,
                        String.format("%d+ small test transactions followed by a withdrawal of $%,.2f+",
                                t.getSmallTestMinCount(), t.getSmallTestLargeAmount()),
                        (txn, ctx) -> txn.isOutbound()
                                && isWithdrawal(txn, t)
                                && txn.getAmount() >= t.getSmallTestLargeAmount()
                                && ctx.atLeast("velocity.small_test_count", t.getSmallTestMinCount())),

                Rule.of("new_counterparty", "relationship", 1.0,
                        "First payment to this counterparty",
                        (txn, ctx) -> txn.isOutbound() && ctx.isTrue("relationship.is_new_counterparty"))
        );
    }

    @Override
    public String prefix() {
        return "core";
    }

    @Override
    public List<Rule> rules() {
        return rules;
    }

    private static boolean isLowActivityLargeTransfer(Transaction txn, Context ctx,
                                                      MonitoringConfig.RuleThresholds t) {
        if (!ctx.number("velocity.total_tx_count_period").map(c -> c <= t.getLowActivityCount()).orElse(false)) {
            return false;
        }
        if (txn.getAmount() < t.getLowActivityMinAmount()) {
            return false;
        }
        // Without history for the type, the minimum amount alone is enough
        return ctx.number("velocity.avg_amount")
                .filter(avg -> avg > 0)
                .map(avg -> txn.getAmount() >= avg * t.getLowActivityMultiplier())
                .orElse(true);
    }

    private static boolean isWithdrawal(Transaction txn, MonitoringConfig.RuleThresholds t) {
        return t.getWithdrawalTypes().stream().anyMatch(txn::isType);
    }
}
