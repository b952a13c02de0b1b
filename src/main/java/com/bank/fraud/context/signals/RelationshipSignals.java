package com.bank.fraud.context.signals;

import com.bank.fraud.config.MonitoringConfig;
import com.bank.fraud.context.SignalGroup;
import com.bank.fraud.context.SignalInput;
import com.bank.fraud.context.SignalMath;
import com.bank.fraud.context.SignalWriter;
import com.bank.fraud.ledger.TransactionLedger;
import com.bank.fraud.model.Beneficiary;
import com.bank.fraud.model.Transaction;
import com.bank.fraud.model.TransactionMetadata;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * How well the account knows the counterparty.
 *
 * The relationship is bucketed by age and recency, and a 0-100 trust score is built from
 * five capped components:
 *
 *   beneficiary  (max 25)  registered +10, verified +10, registered over 30 days +5
 *   history      (max 25)  2 per prior transaction up to 15; last one within 30 days +10, within 90 days +5
 *   contact list (max 15)  counterparty is in the customer's contacts
 *   social       (max 15)  2 per mutual connection up to 10; verified profile +5
 *   pattern      (max 20)  amount CV <= 0.2 +10 (<= 0.5 +5); interval CV <= 0.3 +10 (<= 0.6 +5)
 */
@Component
public class RelationshipSignals implements SignalGroup {

    static final int MIN_PATTERN_HISTORY = 3;

    private final TransactionLedger ledger;
    private final MonitoringConfig.Signals config;

    public RelationshipSignals(TransactionLedger ledger, MonitoringConfig config) {
        this.ledger = ledger;
        this.config = config.getSignals();
    }

    @Override
    public String prefix() {
        return "relationship";
    }

    @Override
    public void contribute(SignalInput input, SignalWriter out) {
        Transaction txn = input.transaction();
        if (!txn.hasCounterparty()) {
            out.unknown("is_new_counterparty");
            return;
        }

        List<Transaction> history = input.priorOnly(ledger.findTransactionsWithCounterparty(
                txn.getAccountId(), txn.getCounterpartyId(), Instant.EPOCH, input.at()));

        out.put("is_new_counterparty", history.isEmpty());
        out.put("prior_transaction_count", (long) history.size());

        Double ageDays = null;
        Double daysSinceLast = null;
        if (!history.isEmpty()) {
            ageDays = SignalInput.daysBetween(history.get(0).getTimestamp(), input.at());
            daysSinceLast = SignalInput.daysBetween(history.get(history.size() - 1).getTimestamp(), input.at());
        }
        String status = status(ageDays, daysSinceLast);

        out.put("relationship_age_days", ageDays);
        out.put("days_since_last_transaction", daysSinceLast);
        out.put("relationship_status", status);
        out.put("is_dormant_reactivation", "dormant".equals(status));

        Map<String, Object> components = new LinkedHashMap<>();
        components.put("beneficiary", beneficiaryPoints(input));
        components.put("history", historyPoints(history.size(), daysSinceLast));
        components.put("contact_list", contactListPoints(input.metadata()));
        components.put("social", socialPoints(input.metadata()));
        components.put("pattern", patternPoints(history));

        long score = components.values().stream().mapToLong(v -> ((Number) v).longValue()).sum();
        out.put("trust_score", score);
        out.put("trust_level", score >= 70 ? "high" : score >= 40 ? "medium" : "low");
        out.put("trust_components", components);
    }

    String status(Double ageDays, Double daysSinceLast) {
        if (ageDays == null || ageDays < config.getRelationshipNewDays()) return "new";
        if (daysSinceLast <= config.getRelationshipActiveDays()) return "active";
        if (daysSinceLast <= config.getRelationshipRecentDays()) return "recent";
        if (daysSinceLast < config.getRelationshipDormantDays()) return "inactive";
        return "dormant";
    }

    private long beneficiaryPoints(SignalInput input) {
        Transaction txn = input.transaction();
        Optional<Beneficiary> beneficiary = ledger.findBeneficiaryByCounterparty(txn.getAccountId(), txn.getCounterpartyId())
                .filter(b -> b.getAddedAt() == null || !b.getAddedAt().isAfter(input.at()));
        if (beneficiary.isEmpty()) return 0;

        long points = 10;
        if (beneficiary.get().isVerified()) points += 10;
        Instant addedAt = beneficiary.get().getAddedAt();
        if (addedAt != null && SignalInput.daysBetween(addedAt, input.at()) > 30) points += 5;
        return points;
    }

    private static long historyPoints(int count, Double daysSinceLast) {
        long points = Math.min(count * 2L, 15L);
        if (daysSinceLast != null) {
            if (daysSinceLast <= 30) points += 10;
            else if (daysSinceLast <= 90) points += 5;
        }
        return points;
    }

    private static long contactListPoints(TransactionMetadata metadata) {
        return metadata.flag("in_contact_list").orElse(false) ? 15 : 0;
    }

    private static long socialPoints(TransactionMetadata metadata) {
        double mutual = metadata.number("social", "mutual_connections").orElse(0.0);
        long points = Math.min((long) Math.max(mutual, 0.0) * 2, 10L);
        if (metadata.flag("social", "verified_profile").orElse(false)) points += 5;
        return points;
    }

    private static long patternPoints(List<Transaction> history) {
        if (history.size() < MIN_PATTERN_HISTORY) return 0;

        long points = 0;
        OptionalDouble amountCv = SignalMath.coefficientOfVariation(
                history.stream().map(Transaction::getAmount).collect(Collectors.toList()));
        if (amountCv.isPresent()) {
            if (amountCv.getAsDouble() <= 0.2) points += 10;
            else if (amountCv.getAsDouble() <= 0.5) points += 5;
        }

        List<Double> intervals = new ArrayList<>();
        for (int i = 1; i < history.size(); i++) {
            intervals.add(SignalInput.hoursBetween(history.get(i - 1).getTimestamp(), history.get(i).getTimestamp()));
        }
        OptionalDouble intervalCv = SignalMath.coefficientOfVariation(intervals);
        if (intervalCv.isPresent()) {
            if (intervalCv.getAsDouble() <= 0.3) points += 10;
            else if (intervalCv.getAsDouble() <= 0.6) points += 5;
        }
        return points;
    }
}
