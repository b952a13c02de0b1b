package com.bank.fraud.context.signals;

import com.bank.fraud.config.MonitoringConfig;
import com.bank.fraud.context.SignalGroup;
import com.bank.fraud.context.SignalInput;
import com.bank.fraud.context.SignalWriter;
import com.bank.fraud.ledger.TransactionLedger;
import com.bank.fraud.model.FraudFlag;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * Prior fraud flags raised against the account and against the counterparty.
 *
 * Severity escalation compares the average severity of flags inside the recent window
 * with the average of older ones; both sides need at least one flag.
 */
@Component
public class FraudHistorySignals implements SignalGroup {

    private final TransactionLedger ledger;
    private final MonitoringConfig.Signals config;

    public FraudHistorySignals(TransactionLedger ledger, MonitoringConfig config) {
        this.ledger = ledger;
        this.config = config.getSignals();
    }

    @Override
    public String prefix() {
        return "history";
    }

    @Override
    public void contribute(SignalInput input, SignalWriter out) {
        entityHistory("account", input.transaction().getAccountId(), input, out);
        if (input.transaction().hasCounterparty()) {
            entityHistory("counterparty", input.transaction().getCounterpartyId(), input, out);
        } else {
            out.unknown("counterparty_prior_fraud_count");
        }
    }

    private void entityHistory(String entityType, String entityId, SignalInput input, SignalWriter out) {
        List<FraudFlag> flags = ledger.findFraudFlags(
                        entityType, entityId, input.daysBack(config.getFraudHistoryLookbackDays()), input.at())
                .stream()
                .filter(f -> f.getFlaggedAt() != null && !f.getFlaggedAt().isAfter(input.at()))
                .collect(Collectors.toList());

        String p = entityType + "_";
        out.put(p + "prior_fraud_count", (long) flags.size());
        out.put(p + "confirmed_count", flags.stream().filter(FraudFlag::isConfirmed).count());
        out.put(p + "is_repeat_offender", flags.size() >= config.getRepeatOffenderCount());

        if (flags.isEmpty()) {
            out.unknown(p + "days_since_last_flag");
            out.put(p + "recency", "none");
            out.put(p + "escalating_severity", false);
            return;
        }

        // Flags come back oldest first
        Instant last = flags.get(flags.size() - 1).getFlaggedAt();
        double daysSince = SignalInput.daysBetween(last, input.at());
        out.put(p + "days_since_last_flag", daysSince);
        out.put(p + "recency", recency(daysSince));

        Instant recentCutoff = input.daysBack(config.getFraudRecentDays());
        OptionalDouble recentAvg = averageSeverity(flags.stream()
                .filter(f -> f.getFlaggedAt().isAfter(recentCutoff)).collect(Collectors.toList()));
        OptionalDouble olderAvg = averageSeverity(flags.stream()
                .filter(f -> !f.getFlaggedAt().isAfter(recentCutoff)).collect(Collectors.toList()));
        out.put(p + "escalating_severity", recentAvg.isPresent() && olderAvg.isPresent()
                && recentAvg.getAsDouble() > olderAvg.getAsDouble());
    }

    static String recency(double daysSince) {
        if (daysSince <= 30) return "last_30d";
        if (daysSince <= 90) return "last_90d";
        if (daysSince <= 365) return "last_365d";
        return "older";
    }

    private static OptionalDouble averageSeverity(List<FraudFlag> flags) {
        return flags.stream()
                .filter(f -> f.getSeverity() != null)
                .mapToInt(f -> f.getSeverity().getScore())
                .average();
    }
}
