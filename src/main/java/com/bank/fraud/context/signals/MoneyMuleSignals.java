package com.bank.fraud.context.signals;

import com.bank.fraud.config.MonitoringConfig;
import com.bank.fraud.context.SignalGroup;
import com.bank.fraud.context.SignalInput;
import com.bank.fraud.context.SignalWriter;
import com.bank.fraud.ledger.TransactionLedger;
import com.bank.fraud.model.Transaction;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Pass-through of funds: many inbound credits followed quickly by outbound debits.
 * The transaction under evaluation is part of every window.
 */
@Component
public class MoneyMuleSignals implements SignalGroup {

    private final TransactionLedger ledger;
    private final MonitoringConfig.Signals config;

    public MoneyMuleSignals(TransactionLedger ledger, MonitoringConfig config) {
        this.ledger = ledger;
        this.config = config.getSignals();
    }

    @Override
    public String prefix() {
        return "mule";
    }

    @Override
    public void contribute(SignalInput input, SignalWriter out) {
        Transaction txn = input.transaction();
        long maxHours = Math.max(config.getTransferGapWindowHours(),
                config.getMuleWindowsHours().stream().mapToLong(Integer::longValue).max().orElse(0));

        List<Transaction> history = new ArrayList<>(input.priorOnly(
                ledger.findTransactions(txn.getAccountId(), input.hoursBack(maxHours), input.at())));
        history.add(txn);
        history.sort(Comparator.comparing(Transaction::getTimestamp));

        for (int hours : config.getMuleWindowsHours()) {
            Instant from = input.hoursBack(hours);
            List<Transaction> window = history.stream()
                    .filter(t -> t.getTimestamp().isAfter(from))
                    .collect(Collectors.toList());

            List<Transaction> incoming = window.stream().filter(Transaction::isInbound).collect(Collectors.toList());
            List<Transaction> outgoing = window.stream().filter(Transaction::isOutbound).collect(Collectors.toList());
            double incomingTotal = incoming.stream().mapToDouble(Transaction::getAmount).sum();
            double outgoingTotal = outgoing.stream().mapToDouble(Transaction::getAmount).sum();

            String suffix = "_" + hours + "h";
            out.put("incoming_count" + suffix, (long) incoming.size());
            out.put("outgoing_count" + suffix, (long) outgoing.size());
            out.put("incoming_total" + suffix, incomingTotal);
            out.put("outgoing_total" + suffix, outgoingTotal);
            out.put("avg_incoming_amount" + suffix, incoming.isEmpty() ? null : incomingTotal / incoming.size());
            out.put("flow_through_ratio" + suffix, incomingTotal > 0 ? outgoingTotal / incomingTotal : 0.0);
        }

        out.put("avg_hours_to_transfer", averageHoursToTransfer(history, input.hoursBack(config.getTransferGapWindowHours())));
    }

    /**
     * Pairs each inbound with the first outbound strictly after it. An outbound may close
     * several inbounds. Null when nothing pairs.
     */
    static Double averageHoursToTransfer(List<Transaction> chronological, Instant after) {
        List<Transaction> incoming = new ArrayList<>();
        List<Transaction> outgoing = new ArrayList<>();
        for (Transaction t : chronological) {
            if (!t.getTimestamp().isAfter(after)) continue;
            if (t.isInbound()) incoming.add(t);
            else if (t.isOutbound()) outgoing.add(t);
        }
        if (incoming.isEmpty() || outgoing.isEmpty()) return null;

        double totalGap = 0.0;
        int pairs = 0;
        for (Transaction in : incoming) {
            for (Transaction o : outgoing) {
                if (o.getTimestamp().isAfter(in.getTimestamp())) {
                    totalGap += SignalInput.hoursBetween(in.getTimestamp(), o.getTimestamp());
                    pairs++;
                    break;
                }
            }
        }
        return pairs == 0 ? null : totalGap / pairs;
    }
}
