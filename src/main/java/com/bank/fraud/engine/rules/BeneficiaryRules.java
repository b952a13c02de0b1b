package com.bank.fraud.engine.rules;

import com.bank.fraud.config.MonitoringConfig;
import com.bank.fraud.engine.Rule;
import com.bank.fraud.engine.RuleSet;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Payments to freshly registered payees and bulk payee registration.
 */
@Component
public class BeneficiaryRules implements RuleSet {

    static final String CATEGORY = "beneficiary";

    private final List<Rule> rules;

    public BeneficiaryRules(MonitoringConfig config) {
        MonitoringConfig.RuleThresholds t = config.getRules();
        int newHours = config.getSignals().getNewBeneficiaryHours();

        this.rules = List.of(
                Rule.of("payment_to_new_beneficiary", CATEGORY, 3.0,
                        String.format("Payment to a beneficiary registered within %d hours", newHours),
                        (txn, ctx) -> txn.isOutbound() && ctx.isTrue("beneficiary.is_new_beneficiary")),

                Rule.of("high_value_to_new_beneficiary", CATEGORY, 3.0,
                        String.format("Payment of $%,.2f+ to a beneficiary registered within %d hours",
                                t.getHighValueBeneficiaryAmount(), newHours),
                        (txn, ctx) -> txn.isOutbound()
                                && txn.getAmount() >= t.getHighValueBeneficiaryAmount()
                                && ctx.isTrue("beneficiary.is_new_beneficiary")),

                Rule.of("unverified_beneficiary", CATEGORY, 1.5,
                        "Payment to an unverified beneficiary",
                        (txn, ctx) -> txn.isOutbound() && ctx.isFalse("beneficiary.is_verified")),

                Rule.of("new_beneficiary_payment_share", CATEGORY, 2.0,
                        String.format("%.0f%%+ of recent payments went to beneficiaries added in the last 72 hours",
                                t.getNewBeneficiaryPaymentRatio() * 100),
                        (txn, ctx) -> ctx.atLeast("beneficiary.new_beneficiary_payment_ratio_72h",
                                t.getNewBeneficiaryPaymentRatio())),

                Rule.of("bulk_beneficiary_addition", CATEGORY, 2.5,
                        String.format("%d+ beneficiaries added in 24 hours", t.getBulkBeneficiaryCount()),
                        (txn, ctx) -> ctx.atLeast("beneficiary.beneficiaries_added_24h", t.getBulkBeneficiaryCount())),

                Rule.of("same_source_beneficiaries", CATEGORY, 2.0,
                        String.format("%d+ beneficiaries added from one IP or by one user in 72 hours",
                                t.getSameSourceBeneficiaryCount()),
                        (txn, ctx) -> ctx.atLeast("beneficiary.top_source_ip_count_72h", t.getSameSourceBeneficiaryCount())
                                || ctx.atLeast("beneficiary.top_added_by_count_72h", t.getSameSourceBeneficiaryCount()))
        );
    }

    @Override
    public String prefix() {
        return "beneficiary";
    }

    @Override
    public List<Rule> rules() {
        return rules;
    }
}
