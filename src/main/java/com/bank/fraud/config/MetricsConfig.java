package com.bank.fraud.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordEvaluation(String decision, double riskScore) {
        Counter.builder("assessment.count")
                .tag("decision", decision)
                .register(registry)
                .increment();

        DistributionSummary.builder("assessment.risk_score")
                .tag("decision", decision)
                .register(registry)
                .record(riskScore);
    }

    public void recordRuleTriggered(String ruleName, String category) {
        Counter.builder("rule.triggered.count")
                .tag("rule", ruleName)
                .tag("category", category)
                .register(registry)
                .increment();
    }

    public void recordDegradedGroup(String group) {
        Counter.builder("context.group.degraded.count")
                .tag("group", group)
                .register(registry)
                .increment();
    }

    public void recordEvaluationFailure(String reason) {
        Counter.builder("assessment.failure.count")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
