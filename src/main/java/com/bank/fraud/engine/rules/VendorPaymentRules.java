package com.bank.fraud.engine.rules;

import com.bank.fraud.config.MonitoringConfig;
import com.bank.fraud.context.Context;
import com.bank.fraud.engine.Rule;
import com.bank.fraud.engine.RuleSet;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Business email compromise: a supplier's bank details are changed on request and the
 * next payment goes straight to the new account. Every rule here applies to vendor
 * payments only.
 */
@Component
public class VendorPaymentRules implements RuleSet {

    static final String CATEGORY = "vendor-fraud";

    private final List<Rule> rules;

    public VendorPaymentRules(MonitoringConfig config) {
        MonitoringConfig.RuleThresholds t = config.getRules();
        MonitoringConfig.Signals s = config.getSignals();

        this.rules = List.of(
                Rule.of("same_day_payment_after_change", CATEGORY, 5.0,
                        String.format("Payment within %d hours of a beneficiary bank-detail change", s.getSameDayChangeHours()),
                        (txn, ctx) -> vendor(ctx) && ctx.atLeast("beneficiary.changes_24h", 1)),

                Rule.of("recent_account_change_payment", CATEGORY, 4.0,
                        String.format("Payment to beneficiary with bank details changed within %d days",
                                s.getCriticalChangeWindowDays()),
                        (txn, ctx) -> vendor(ctx) && ctx.atLeast("beneficiary.changes_7d", 1)),

                Rule.of("unverified_account_change", CATEGORY, 4.5,
                        "Payment to beneficiary with unverified banking information changes",
                        (txn, ctx) -> vendor(ctx) && ctx.atLeast("beneficiary.unverified_change_count", 1)),

                Rule.of("suspicious_change_source", CATEGORY, 3.5,
                        "Beneficiary bank details changed via email/phone/fax request",
                        (txn, ctx) -> vendor(ctx) && !ctx.list("beneficiary.suspicious_change_sources").isEmpty()),

                Rule.of("first_payment_after_change", CATEGORY, 3.0,
                        "First payment to beneficiary after account information change",
                        (txn, ctx) -> vendor(ctx) && ctx.isTrue("beneficiary.first_payment_after_change")),

                Rule.of("high_value_payment", CATEGORY, 2.5,
                        String.format("High-value payment to beneficiary (>= $%,.2f)", t.getHighValueBeneficiaryAmount()),
                        (txn, ctx) -> vendor(ctx) && txn.getAmount() >= t.getHighValueBeneficiaryAmount()),

                Rule.of("rapid_account_changes", CATEGORY, 3.5,
                        String.format("%d+ beneficiary bank-detail changes within %d days",
                                t.getRapidChangeCount(), s.getRapidChangeWindowDays()),
                        (txn, ctx) -> vendor(ctx) && ctx.atLeast("beneficiary.rapid_change_count", t.getRapidChangeCount())),

                Rule.of("weekend_account_change", CATEGORY, 2.0,
                        "Beneficiary bank details changed on a weekend",
                        (txn, ctx) -> vendor(ctx) && ctx.atLeast("beneficiary.weekend_change_count", 1)),

                Rule.of("off_hours_account_change", CATEGORY, 1.5,
                        String.format("Beneficiary bank details changed off-hours (%02d:00-%02d:00)",
                                s.getOddHoursStart(), s.getOddHoursEnd()),
                        (txn, ctx) -> vendor(ctx) && ctx.atLeast("beneficiary.off_hours_change_count", 1))
        );
    }

    @Override
    public String prefix() {
        return "vendor";
    }

    @Override
    public List<Rule> rules() {
        return rules;
    }

    private static boolean vendor(Context ctx) {
        return ctx.isTrue("beneficiary.is_vendor_payment");
    }
}
