package com.bank.fraud.engine;

import com.bank.fraud.context.Context;
import com.bank.fraud.model.Transaction;
import com.bank.fraud.model.TriggeredRule;
import lombok.Builder;
import lombok.Value;

/**
 * A named, versioned, weighted predicate. Hard-override rules force a BLOCKED decision
 * whatever the aggregated score.
 */
@Value
@Builder(toBuilder = true)
public class Rule {

    String name;
    @Builder.Default
    int version = 1;
    String category;
    double weight;
    String description;
    boolean hardOverride;
    RulePredicate predicate;

    public static Rule of(String name, String category, double weight, String description,
                          RulePredicate predicate) {
        return Rule.builder()
                .name(name).category(category).weight(weight)
                .description(description).predicate(predicate)
                .build();
    }

    /**
     * A rule whose trigger blocks the transaction outright.
     */
    public static Rule blocking(String name, String category, double weight, String description,
                                RulePredicate predicate) {
        return of(name, category, weight, description, predicate).toBuilder().hardOverride(true).build();
    }

    public boolean evaluate(Transaction txn, Context context) {
        return predicate.test(txn, context);
    }

    public TriggeredRule toTriggered() {
        return TriggeredRule.builder()
                .ruleName(name)
                .category(category)
                .version(version)
                .weight(weight)
                .description(description)
                .hardOverride(hardOverride)
                .build();
    }
}
