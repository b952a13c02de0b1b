package com.bank.fraud.engine.rules;

import com.bank.fraud.config.MonitoringConfig;
import com.bank.fraud.engine.Rule;
import com.bank.fraud.engine.RuleSet;
import com.bank.fraud.model.Transaction;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Payroll diversion: an employee's deposit details are changed shortly before a payroll
 * run, or a payroll payment goes somewhere it has never gone before.
 */
@Component
public class PayrollRules implements RuleSet {

    static final String CATEGORY = "payroll-fraud";

    private final List<Rule> rules;

    public PayrollRules(MonitoringConfig config) {
        MonitoringConfig.RuleThresholds t = config.getRules();
        List<String> payrollTypes = List.copyOf(t.getPayrollTypes());

        this.rules = List.of(
                Rule.of("payroll_after_account_change", CATEGORY, 4.0,
                        "Payroll payment to an account whose bank details changed in the last 7 days",
                        (txn, ctx) -> isPayroll(txn, payrollTypes) && ctx.atLeast("beneficiary.changes_7d", 1)),

                Rule.of("payroll_unverified_change", CATEGORY, 3.0,
                        "Payroll payment after an unverified bank-detail change",
                        (txn, ctx) -> isPayroll(txn, payrollTypes)
                                && ctx.atLeast("beneficiary.unverified_change_count", 1)),

                Rule.of("payroll_amount_deviation", CATEGORY, 2.5,
                        String.format("Payroll amount deviates %.1f+ sigma from prior payroll", t.getPayrollDeviationSigma()),
                        (txn, ctx) -> isPayroll(txn, payrollTypes)
                                && ctx.atLeast("velocity.amount_deviation", t.getPayrollDeviationSigma())),

                Rule.of("payroll_to_new_recipient", CATEGORY, 2.0,
                        "Payroll payment to a counterparty never paid before",
                        (txn, ctx) -> isPayroll(txn, payrollTypes) && ctx.isTrue("relationship.is_new_counterparty"))
        );
    }

    @Override
    public String prefix() {
        return "payroll";
    }

    @Override
    public List<Rule> rules() {
        return rules;
    }

    private static boolean isPayroll(Transaction txn, List<String> payrollTypes) {
        return txn.isOutbound() && payrollTypes.stream().anyMatch(txn::isType);
    }
}
