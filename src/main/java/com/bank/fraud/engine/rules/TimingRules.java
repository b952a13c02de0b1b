package com.bank.fraud.engine.rules;

import com.bank.fraud.config.MonitoringConfig;
import com.bank.fraud.engine.Rule;
import com.bank.fraud.engine.RuleSet;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class TimingRules implements RuleSet {

    static final String CATEGORY = "odd-hours";

    private final List<Rule> rules;

    public TimingRules(MonitoringConfig config) {
        MonitoringConfig.Signals s = config.getSignals();

        this.rules = List.of(
                Rule.of("odd_hour_transaction", CATEGORY, 0.5,
                        String.format("Transaction between %02d:00 and %02d:00", s.getOddHoursStart(), s.getOddHoursEnd()),
                        (txn, ctx) -> ctx.isTrue("timing.is_odd_hour")),

                Rule.of("unusual_hour_for_account", CATEGORY, 1.5,
                        "Odd-hour transaction from an account that rarely transacts at night",
                        (txn, ctx) -> ctx.isTrue("timing.deviates_from_hour_pattern")),

                Rule.of("unusual_weekend_for_account", CATEGORY, 1.0,
                        "Weekend transaction from an account that rarely transacts on weekends",
                        (txn, ctx) -> ctx.isTrue("timing.deviates_from_weekend_pattern"))
        );
    }

    @Override
    public String prefix() {
        return "timing";
    }

    @Override
    public List<Rule> rules() {
        return rules;
    }
}
