package com.bank.fraud.engine.rules;

import com.bank.fraud.engine.Rule;
import com.bank.fraud.engine.RuleSet;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class CheckFraudRules implements RuleSet {

    static final String CATEGORY = "check-fraud";

    private final List<Rule> rules = List.of(
            Rule.of("duplicate_check", CATEGORY, 5.0,
                    "Check with the same number and amount was already deposited",
                    (txn, ctx) -> ctx.isTrue("check.is_duplicate_check")),

            Rule.of("check_number_reused", CATEGORY, 2.5,
                    "Check number already deposited with a different amount",
                    (txn, ctx) -> ctx.atLeast("check.same_number_count", 1) && ctx.isFalse("check.is_duplicate_check")),

            Rule.of("check_amount_mismatch", CATEGORY, 2.0,
                    "Check amount differs from the deposited amount",
                    (txn, ctx) -> ctx.isTrue("check.amount_mismatch"))
    );

    @Override
    public String prefix() {
        return "check";
    }

    @Override
    public List<Rule> rules() {
        return rules;
    }
}
