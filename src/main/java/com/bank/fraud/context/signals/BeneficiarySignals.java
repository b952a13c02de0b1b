package com.bank.fraud.context.signals;

import com.bank.fraud.config.MonitoringConfig;
import com.bank.fraud.context.SignalGroup;
import com.bank.fraud.context.SignalInput;
import com.bank.fraud.context.SignalWriter;
import com.bank.fraud.ledger.TransactionLedger;
import com.bank.fraud.model.Beneficiary;
import com.bank.fraud.model.BeneficiaryChange;
import com.bank.fraud.model.Transaction;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Beneficiary freshness and bank-detail change history.
 *
 * Window signals look at how many payees the account registered recently, where they
 * were registered from, and how much of the recent outbound flow went to them. The
 * payee of the current transaction (by metadata beneficiary_id, else by counterparty)
 * is then checked for age, verification and recent account/routing number changes,
 * the usual shape of a vendor impersonation attack.
 */
@Component
public class BeneficiarySignals implements SignalGroup {

    private final TransactionLedger ledger;
    private final MonitoringConfig.Signals config;

    public BeneficiarySignals(TransactionLedger ledger, MonitoringConfig config) {
        this.ledger = ledger;
        this.config = config.getSignals();
    }

    @Override
    public String prefix() {
        return "beneficiary";
    }

    @Override
    public void contribute(SignalInput input, SignalWriter out) {
        Transaction txn = input.transaction();
        out.put("is_vendor_payment", isVendorPayment(txn));

        windowSignals(input, out);
        payeeSignals(input, out);
    }

    private void windowSignals(SignalInput input, SignalWriter out) {
        Transaction txn = input.transaction();
        long maxHours = config.getBeneficiaryWindowsHours().stream().mapToLong(Integer::longValue).max().orElse(0);
        Instant earliest = input.hoursBack(maxHours);

        List<Beneficiary> added = ledger.findBeneficiaries(txn.getAccountId(), earliest, input.at());
        List<Transaction> outbound = input.priorOnly(ledger.findTransactions(txn.getAccountId(), earliest, input.at()))
                .stream().filter(Transaction::isOutbound).collect(Collectors.toList());

        for (int hours : config.getBeneficiaryWindowsHours()) {
            Instant from = input.hoursBack(hours);
            String suffix = "_" + hours + "h";

            List<Beneficiary> inWindow = added.stream()
                    .filter(b -> b.getAddedAt() != null && b.getAddedAt().isAfter(from))
                    .collect(Collectors.toList());
            out.put("beneficiaries_added" + suffix, (long) inWindow.size());

            Map.Entry<String, Long> topIp = mostCommon(inWindow, Beneficiary::getIpAddress);
            out.put("top_source_ip" + suffix, topIp == null ? null : topIp.getKey());
            out.put("top_source_ip_count" + suffix, topIp == null ? 0L : topIp.getValue());

            Map.Entry<String, Long> topUser = mostCommon(inWindow, Beneficiary::getAddedBy);
            out.put("top_added_by" + suffix, topUser == null ? null : topUser.getKey());
            out.put("top_added_by_count" + suffix, topUser == null ? 0L : topUser.getValue());

            Set<String> newPayees = inWindow.stream()
                    .map(Beneficiary::getCounterpartyId)
                    .filter(Objects::nonNull)
                    .collect(Collectors.toCollection(HashSet::new));
            List<Transaction> payments = outbound.stream()
                    .filter(t -> t.getTimestamp().isAfter(from))
                    .collect(Collectors.toList());
            if (payments.isEmpty()) {
                out.unknown("new_beneficiary_payment_ratio" + suffix);
            } else {
                long toNew = payments.stream().filter(t -> newPayees.contains(t.getCounterpartyId())).count();
                out.put("new_beneficiary_payment_ratio" + suffix, (double) toNew / payments.size());
            }
        }
    }

    private void payeeSignals(SignalInput input, SignalWriter out) {
        Transaction txn = input.transaction();
        Optional<Beneficiary> payee = resolvePayee(input);

        if (payee.isEmpty()) {
            // Registered status is only meaningful when there is a payee to look up
            boolean lookedUp = txn.hasCounterparty() || input.metadata().has("beneficiary_id");
            out.put("is_registered", lookedUp ? Boolean.FALSE : null);
            out.unknown("is_new_beneficiary");
            out.unknown("beneficiary_age_hours");
            out.unknown("is_verified");
            out.unknown("changes_24h");
            out.unknown("changes_7d");
            out.unknown("rapid_change_count");
            out.unknown("unverified_change_count");
            out.unknown("suspicious_change_sources");
            out.unknown("weekend_change_count");
            out.unknown("off_hours_change_count");
            out.unknown("hours_since_last_change");
            out.unknown("first_payment_after_change");
            return;
        }

        Beneficiary bene = payee.get();
        out.put("is_registered", true);
        out.put("beneficiary_id", bene.getBeneficiaryId());
        out.put("is_verified", bene.isVerified());
        if (bene.getAddedAt() != null) {
            double ageHours = SignalInput.hoursBetween(bene.getAddedAt(), input.at());
            out.put("beneficiary_age_hours", ageHours);
            out.put("is_new_beneficiary", ageHours <= config.getNewBeneficiaryHours());
        } else {
            out.unknown("beneficiary_age_hours");
            out.unknown("is_new_beneficiary");
        }

        // --- Bank-detail change history ---
        int lookbackDays = Math.max(config.getRapidChangeWindowDays(), config.getCriticalChangeWindowDays());
        List<BeneficiaryChange> changes = ledger.findBeneficiaryChanges(
                        bene.getBeneficiaryId(), input.daysBack(lookbackDays), input.at())
                .stream().filter(BeneficiaryChange::isBankDetailChange)
                .collect(Collectors.toList());

        Instant sameDay = input.hoursBack(config.getSameDayChangeHours());
        Instant critical = input.daysBack(config.getCriticalChangeWindowDays());
        Instant rapid = input.daysBack(config.getRapidChangeWindowDays());
        List<BeneficiaryChange> recent = changes.stream()
                .filter(c -> c.getChangedAt().isAfter(critical))
                .collect(Collectors.toList());

        out.put("changes_24h", changes.stream().filter(c -> c.getChangedAt().isAfter(sameDay)).count());
        out.put("changes_7d", (long) recent.size());
        out.put("rapid_change_count", changes.stream().filter(c -> c.getChangedAt().isAfter(rapid)).count());
        out.put("unverified_change_count", recent.stream().filter(c -> !c.isVerified()).count());

        Set<String> suspicious = config.getSuspiciousChangeSources().stream()
                .map(s -> s.toLowerCase(Locale.ROOT)).collect(Collectors.toSet());
        out.put("suspicious_change_sources", recent.stream()
                .map(BeneficiaryChange::getChangeSource)
                .filter(s -> s != null && suspicious.contains(s.toLowerCase(Locale.ROOT)))
                .collect(Collectors.toList()));

        ZoneId zone = ZoneId.of(config.getTimezone());
        out.put("weekend_change_count", recent.stream().filter(c -> OddHoursSignals.isWeekend(c.getChangedAt(), zone)).count());
        out.put("off_hours_change_count", recent.stream()
                .filter(c -> OddHoursSignals.isOddHour(c.getChangedAt().atZone(zone).getHour(),
                        config.getOddHoursStart(), config.getOddHoursEnd()))
                .count());

        Optional<Instant> lastChange = changes.stream().map(BeneficiaryChange::getChangedAt).max(Comparator.naturalOrder());
        out.put("hours_since_last_change", lastChange.map(c -> SignalInput.hoursBetween(c, input.at())).orElse(null));

        if (bene.getLastPaymentAt() == null) {
            out.put("first_payment_after_change", false);
        } else {
            Instant lastPayment = bene.getLastPaymentAt();
            boolean changedSincePayment = ledger.findBeneficiaryChanges(bene.getBeneficiaryId(), lastPayment, input.at())
                    .stream().anyMatch(c -> c.isBankDetailChange() && !"bank_name".equalsIgnoreCase(c.getChangeType()));
            out.put("first_payment_after_change", changedSincePayment);
            out.put("days_since_last_payment", SignalInput.daysBetween(lastPayment, input.at()));
        }
    }

    private Optional<Beneficiary> resolvePayee(SignalInput input) {
        Transaction txn = input.transaction();
        Optional<Beneficiary> payee = input.metadata().text("beneficiary_id").flatMap(ledger::findBeneficiary);
        if (payee.isEmpty() && txn.hasCounterparty()) {
            payee = ledger.findBeneficiaryByCounterparty(txn.getAccountId(), txn.getCounterpartyId());
        }
        // A payee registered after the transaction did not exist at evaluation time
        return payee.filter(b -> b.getAddedAt() == null || !b.getAddedAt().isAfter(input.at()));
    }

    boolean isVendorPayment(Transaction txn) {
        if (!txn.isOutbound()) return false;
        boolean typeMatch = txn.getTransactionType() != null && config.getVendorPaymentTypes().stream()
                .anyMatch(txn::isType);
        String description = txn.getDescription() == null ? "" : txn.getDescription().toLowerCase(Locale.ROOT);
        return typeMatch || config.getVendorPaymentKeywords().stream()
                .anyMatch(k -> description.contains(k.toLowerCase(Locale.ROOT)));
    }

    /**
     * Most frequent non-null attribute; ties go to the lexicographically smallest value.
     */
    private static <T> Map.Entry<String, Long> mostCommon(List<T> items, Function<T, String> attribute) {
        Map<String, Long> counts = new TreeMap<>();
        for (T item : items) {
            String value = attribute.apply(item);
            if (value != null && !value.isBlank()) counts.merge(value, 1L, Long::sum);
        }
        Map.Entry<String, Long> best = null;
        for (Map.Entry<String, Long> e : counts.entrySet()) {
            if (best == null || e.getValue() > best.getValue()) best = e;
        }
        return best;
    }
}
