package com.bank.fraud.engine;

import java.util.List;

/**
 * A scenario-specific group of rules. Rule names are given without the prefix; the
 * catalog qualifies them as {@code <prefix>.<name>}.
 */
public interface RuleSet {

    String prefix();

    List<Rule> rules();
}
