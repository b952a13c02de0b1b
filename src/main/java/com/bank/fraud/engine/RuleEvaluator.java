package com.bank.fraud.engine;

import com.bank.fraud.config.MetricsConfig;
import com.bank.fraud.context.Context;
import com.bank.fraud.exception.MalformedContextException;
import com.bank.fraud.model.Transaction;
import com.bank.fraud.model.TriggeredRule;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs every rule of the catalog against one transaction and its context.
 *
 * Triggered rules come back in catalog order. A rule that hits a malformed signal aborts
 * the whole evaluation; nothing is skipped silently.
 */
@Component
public class RuleEvaluator {

    private static final Logger log = LoggerFactory.getLogger(RuleEvaluator.class);

    private final RuleCatalog catalog;
    private final MetricsConfig metricsConfig;

    public RuleEvaluator(RuleCatalog catalog, MetricsConfig metricsConfig) {
        this.catalog = catalog;
        this.metricsConfig = metricsConfig;
        log.info("Rule evaluator loaded with {} rules", catalog.size());
    }

    @Observed(name = "rules.evaluate_all", contextualName = "evaluate-all-rules")
    public List<TriggeredRule> run(Transaction txn, Context context) {
        List<TriggeredRule> triggered = new ArrayList<>();

        for (Rule rule : catalog.getRules()) {
            boolean hit;
            try {
                hit = rule.evaluate(txn, context);
            } catch (MalformedContextException e) {
                log.error("Malformed context while evaluating rule {} for txn {}: {}",
                        rule.getName(), txn.getTransactionId(), e.getMessage());
                throw new MalformedContextException("Rule " + rule.getName() + ": " + e.getMessage(), e);
            }

            if (hit) {
                triggered.add(rule.toTriggered());
                metricsConfig.recordRuleTriggered(rule.getName(), rule.getCategory());
                log.debug("Rule triggered: {} for account {} txn {} weight={}{}",
                        rule.getName(), txn.getAccountId(), txn.getTransactionId(), rule.getWeight(),
                        rule.isHardOverride() ? " (hard override)" : "");
            }
        }

        return triggered;
    }

    public RuleCatalog getCatalog() {
        return catalog;
    }
}
