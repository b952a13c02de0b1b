package com.bank.fraud.context.signals;

import com.bank.fraud.config.MonitoringConfig;
import com.bank.fraud.context.SignalGroup;
import com.bank.fraud.context.SignalInput;
import com.bank.fraud.context.SignalMath;
import com.bank.fraud.context.SignalWriter;
import com.bank.fraud.ledger.TransactionLedger;
import com.bank.fraud.model.Transaction;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Transaction counts per window, small-deposit counts, and how far the amount sits from
 * the account's history for the same transaction type.
 *
 * Amount deviation has three regimes:
 *   1. No same-type history: a fixed cold-start deviation.
 *   2. All historical amounts identical (stddev 0): |amount / avg|.
 *   3. Otherwise: |amount - avg| / stddev.
 */
@Component
public class VelocitySignals implements SignalGroup {

    private final TransactionLedger ledger;
    private final MonitoringConfig.Signals config;

    public VelocitySignals(TransactionLedger ledger, MonitoringConfig config) {
        this.ledger = ledger;
        this.config = config.getSignals();
    }

    @Override
    public String prefix() {
        return "velocity";
    }

    @Override
    public void contribute(SignalInput input, SignalWriter out) {
        Transaction txn = input.transaction();
        Set<String> inboundTypes = config.getInboundTypes().stream()
                .map(t -> t.toUpperCase(Locale.ROOT)).collect(Collectors.toSet());

        long maxWindowHours = config.getVelocityWindowsHours().stream().mapToLong(Integer::longValue).max().orElse(0);
        long lookbackHours = Math.max(maxWindowHours,
                Math.max(config.getAmountLookbackDays() * 24L, config.getSmallTestLookbackHours()));
        List<Transaction> prior = input.priorOnly(
                ledger.findTransactions(txn.getAccountId(), input.hoursBack(lookbackHours), input.at()));

        // --- Window counts ---
        boolean currentIsSmallDeposit = isSmallDeposit(txn, inboundTypes);
        for (int hours : config.getVelocityWindowsHours()) {
            Instant from = input.hoursBack(hours);
            List<Transaction> inWindow = within(prior, from);
            long smallDeposits = inWindow.stream().filter(t -> isSmallDeposit(t, inboundTypes)).count()
                    + (currentIsSmallDeposit ? 1 : 0);
            out.put("tx_count_" + hours + "h", (long) inWindow.size());
            out.put("small_deposit_count_" + hours + "h", smallDeposits);
        }

        // --- Amount statistics for the same transaction type ---
        List<Transaction> period = within(prior, input.daysBack(config.getAmountLookbackDays()));
        out.put("total_tx_count_period", (long) period.size());

        List<Double> sameTypeAmounts = period.stream()
                .filter(t -> txn.getTransactionType() != null && t.isType(txn.getTransactionType()))
                .map(Transaction::getAmount)
                .collect(Collectors.toList());
        out.put("same_type_count", (long) sameTypeAmounts.size());

        if (sameTypeAmounts.isEmpty()) {
            out.unknown("avg_amount");
            out.unknown("amount_stddev");
            out.put("amount_deviation", config.getColdStartDeviation());
        } else {
            double avg = SignalMath.mean(sameTypeAmounts).getAsDouble();
            double stdDev = SignalMath.populationStdDev(sameTypeAmounts).getAsDouble();
            OptionalDouble z = SignalMath.zScore(txn.getAmount(), avg, stdDev);
            double deviation = z.isPresent()
                    ? z.getAsDouble()
                    : Math.abs(txn.getAmount() / Math.max(avg, 0.01));
            out.put("avg_amount", avg);
            out.put("amount_stddev", stdDev);
            out.put("amount_deviation", deviation);
        }

        // --- Small test transactions ahead of a larger one ---
        List<Transaction> smallTests = within(prior, input.hoursBack(config.getSmallTestLookbackHours())).stream()
                .filter(t -> t.getAmount() > 0 && t.getAmount() <= config.getSmallTestThreshold())
                .collect(Collectors.toList());
        out.put("small_test_count", (long) smallTests.size());
        out.put("small_test_sum", smallTests.stream().mapToDouble(Transaction::getAmount).sum());
    }

    private boolean isSmallDeposit(Transaction t, Set<String> inboundTypes) {
        return t.isInbound()
                && t.getAmount() <= config.getSmallDepositThreshold()
                && t.getTransactionType() != null
                && inboundTypes.contains(t.getTransactionType().toUpperCase(Locale.ROOT));
    }

    private static List<Transaction> within(List<Transaction> records, Instant after) {
        if (records.isEmpty()) return Collections.emptyList();
        return records.stream().filter(t -> t.getTimestamp().isAfter(after)).collect(Collectors.toList());
    }
}
