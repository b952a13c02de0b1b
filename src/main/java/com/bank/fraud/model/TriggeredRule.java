package com.bank.fraud.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Audit entry for a rule whose predicate held for a transaction.
 * Re-aggregating the weights of an assessment's triggered rules reproduces its score.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggeredRule {
    private String ruleName;
    private String category;
    private int version;
    private double weight;
    private String description;
    private boolean hardOverride;
}
