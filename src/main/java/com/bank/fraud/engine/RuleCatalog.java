package com.bank.fraud.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered, immutable list of rules evaluated for every transaction.
 *
 * Built once at startup by composing {@link RuleSet}s. Each set's rules are qualified
 * with its prefix, so two sets can use the same short name without colliding. A catalog
 * is a plain value: tests build their own instead of relying on a shared registry.
 */
public final class RuleCatalog {

    private static final Logger log = LoggerFactory.getLogger(RuleCatalog.class);

    private final List<Rule> rules;
    private final Map<String, Rule> byName;

    private RuleCatalog(List<Rule> rules) {
        Map<String, Rule> index = new LinkedHashMap<>();
        for (Rule rule : rules) {
            if (rule.getName() == null || rule.getName().isBlank()) {
                throw new IllegalArgumentException("Rule without a name");
            }
            if (rule.getPredicate() == null) {
                throw new IllegalArgumentException("Rule " + rule.getName() + " has no predicate");
            }
            if (!(rule.getWeight() > 0.0) || Double.isInfinite(rule.getWeight())) {
                throw new IllegalArgumentException("Rule " + rule.getName()
                        + " must have a positive weight but has " + rule.getWeight());
            }
            if (index.putIfAbsent(rule.getName(), rule) != null) {
                throw new IllegalArgumentException("Duplicate rule name: " + rule.getName());
            }
        }
        this.rules = List.copyOf(rules);
        this.byName = Collections.unmodifiableMap(index);
    }

    /**
     * Catalog from fully named rules, kept in the given order.
     */
    public static RuleCatalog of(List<Rule> rules) {
        return new RuleCatalog(rules);
    }

    public static RuleCatalog compose(List<? extends RuleSet> sets) {
        return compose(sets, Map.of(), Set.of());
    }

    /**
     * Concatenate rule sets in order, qualifying every rule as {@code <prefix>.<name>}.
     *
     * @param weightOverrides replacement weights keyed by qualified rule name
     * @param disabled        qualified names of rules to leave out
     * @throws IllegalArgumentException on a duplicate prefix or rule name, a non-positive
     *                                  weight, or an override/disable entry naming no rule
     */
    public static RuleCatalog compose(List<? extends RuleSet> sets,
                                      Map<String, Double> weightOverrides,
                                      Collection<String> disabled) {
        Set<String> prefixes = new HashSet<>();
        Set<String> unusedOverrides = new HashSet<>(weightOverrides.keySet());
        Set<String> unusedDisabled = new HashSet<>(disabled);
        List<Rule> composed = new ArrayList<>();

        for (RuleSet set : sets) {
            String prefix = set.prefix();
            if (!prefixes.add(prefix)) {
                throw new IllegalArgumentException("Duplicate rule set prefix: " + prefix);
            }
            for (Rule rule : set.rules()) {
                String name = prefix + "." + rule.getName();
                unusedDisabled.remove(name);
                if (disabled.contains(name)) {
                    log.info("Rule {} disabled by configuration", name);
                    unusedOverrides.remove(name);
                    continue;
                }
                Rule.RuleBuilder qualified = rule.toBuilder().name(name);
                Double override = weightOverrides.get(name);
                if (override != null) {
                    unusedOverrides.remove(name);
                    qualified.weight(override);
                }
                composed.add(qualified.build());
            }
        }

        if (!unusedOverrides.isEmpty() || !unusedDisabled.isEmpty()) {
            Set<String> unknown = new HashSet<>(unusedOverrides);
            unknown.addAll(unusedDisabled);
            throw new IllegalArgumentException("Rule configuration names unknown rules: " + unknown);
        }
        return new RuleCatalog(composed);
    }

    public List<Rule> getRules() {
        return rules;
    }

    public Optional<Rule> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public int size() {
        return rules.size();
    }
}
