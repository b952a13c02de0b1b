package com.bank.fraud.service;

import com.bank.fraud.config.MonitoringConfig;
import com.bank.fraud.model.TriggeredRule;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

/**
 * Turns triggered rules into a risk score in [0, 1].
 *
 * score = min(sum(weights) / K, 1.0). The sum is exact, so the score does not depend
 * on the order the rules triggered in.
 */
@Service
public class RiskScorer {

    private final BigDecimal divisor;
    private final String scoringVersion;

    public RiskScorer(MonitoringConfig config) {
        double k = config.getScoring().getNormalizationDivisor();
        if (!(k > 0.0) || Double.isInfinite(k)) {
            throw new IllegalStateException("Normalization divisor must be positive, got " + k);
        }
        this.divisor = BigDecimal.valueOf(k);
        this.scoringVersion = "sum-v1/K=" + k;
    }

    public double score(List<TriggeredRule> triggered) {
        if (triggered.isEmpty()) {
            return 0.0;
        }

        BigDecimal sum = BigDecimal.ZERO;
        for (TriggeredRule rule : triggered) {
            sum = sum.add(BigDecimal.valueOf(rule.getWeight()));
        }

        double normalized = sum.divide(divisor, MathContext.DECIMAL64).doubleValue();
        return Math.min(normalized, 1.0);
    }

    /**
     * Identifies the formula and divisor; stored with every assessment.
     */
    public String scoringVersion() {
        return scoringVersion;
    }
}
