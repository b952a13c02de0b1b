package com.bank.fraud.engine.rules;

import com.bank.fraud.config.MonitoringConfig;
import com.bank.fraud.engine.Rule;
import com.bank.fraud.engine.RuleSet;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class AccountTakeoverRules implements RuleSet {

    static final String CATEGORY = "account-takeover";

    private final List<Rule> rules;

    public AccountTakeoverRules(MonitoringConfig config) {
        double maxHours = config.getRules().getAtoMaxHoursSinceChange();

        this.rules = List.of(
                Rule.of("outbound_after_credential_change", CATEGORY, 3.0,
                        String.format("Outbound payment within %.0f hours of a phone/device/SIM/email change", maxHours),
                        (txn, ctx) -> txn.isOutbound() && ctx.number("ato.hours_since_change")
                                .map(h -> h <= maxHours).orElse(false)),

                Rule.of("first_outbound_after_change", CATEGORY, 2.5,
                        "First outbound payment since a phone/device/SIM/email change",
                        (txn, ctx) -> ctx.isTrue("ato.is_first_outbound_after_change")
                                && ctx.number("ato.hours_since_change").map(h -> h <= maxHours).orElse(false)),

                Rule.of("sim_swap_24h", CATEGORY, 3.0,
                        "Outbound payment within 24 hours of a SIM change",
                        (txn, ctx) -> txn.isOutbound() && ctx.isTrue("ato.sim_change_24h"))
        );
    }

    @Override
    public String prefix() {
        return "ato";
    }

    @Override
    public List<Rule> rules() {
        return rules;
    }
}
