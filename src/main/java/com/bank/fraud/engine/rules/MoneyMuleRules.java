package com.bank.fraud.engine.rules;

import com.bank.fraud.config.MonitoringConfig;
import com.bank.fraud.engine.Rule;
import com.bank.fraud.engine.RuleSet;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class MoneyMuleRules implements RuleSet {

    static final String CATEGORY = "money-mule";

    private final List<Rule> rules;

    public MoneyMuleRules(MonitoringConfig config) {
        MonitoringConfig.RuleThresholds t = config.getRules();

        this.rules = List.of(
                Rule.of("rapid_flow_through", CATEGORY, 3.0,
                        String.format("%d+ inbound payments with %.0f%%+ passed on within 72 hours",
                                t.getMuleMinIncoming(), t.getMuleFlowThroughRatio() * 100),
                        (txn, ctx) -> ctx.atLeast("mule.incoming_count_72h", t.getMuleMinIncoming())
                                && ctx.atLeast("mule.flow_through_ratio_72h", t.getMuleFlowThroughRatio())),

                Rule.of("many_small_incoming", CATEGORY, 1.5,
                        String.format("%d+ inbound payments averaging under $%,.2f in 7 days",
                                t.getMuleMinIncoming(), t.getMuleMaxAvgIncoming()),
                        (txn, ctx) -> ctx.atLeast("mule.incoming_count_168h", t.getMuleMinIncoming())
                                && ctx.below("mule.avg_incoming_amount_168h", t.getMuleMaxAvgIncoming())),

                Rule.of("quick_pass_through", CATEGORY, 2.5,
                        String.format("Funds leave on average within %.0f hours of arriving", t.getMuleMaxHoursToTransfer()),
                        (txn, ctx) -> txn.isOutbound()
                                && ctx.below("mule.avg_hours_to_transfer", t.getMuleMaxHoursToTransfer())
                                && ctx.atLeast("mule.flow_through_ratio_168h", t.getMuleFlowThroughRatio()))
        );
    }

    @Override
    public String prefix() {
        return "mule";
    }

    @Override
    public List<Rule> rules() {
        return rules;
    }
}
