package com.bank.fraud.context.signals;

import com.bank.fraud.config.MonitoringConfig;
import com.bank.fraud.context.SignalGroup;
import com.bank.fraud.context.SignalInput;
import com.bank.fraud.context.SignalWriter;
import com.bank.fraud.ledger.TransactionLedger;
import com.bank.fraud.model.AccountChange;
import com.bank.fraud.model.Transaction;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Account-takeover indicators: a phone, device, SIM or email change shortly before
 * money leaves the account, especially when this is the first outbound payment since.
 */
@Component
public class AccountTakeoverSignals implements SignalGroup {

    static final List<String> CHANGE_TYPES = List.of("phone", "device", "sim", "email");

    private final TransactionLedger ledger;
    private final MonitoringConfig.Signals config;

    public AccountTakeoverSignals(TransactionLedger ledger, MonitoringConfig config) {
        this.ledger = ledger;
        this.config = config.getSignals();
    }

    @Override
    public String prefix() {
        return "ato";
    }

    @Override
    public void contribute(SignalInput input, SignalWriter out) {
        Transaction txn = input.transaction();
        long maxHours = config.getAtoWindowsHours().stream().mapToLong(Integer::longValue).max().orElse(0);
        Set<String> tracked = Set.copyOf(CHANGE_TYPES);

        List<AccountChange> changes = ledger.findAccountChanges(txn.getAccountId(), input.hoursBack(maxHours), input.at())
                .stream()
                .filter(c -> c.getChangeType() != null && tracked.contains(c.getChangeType().toLowerCase(Locale.ROOT)))
                .toList();

        for (int hours : config.getAtoWindowsHours()) {
            Instant from = input.hoursBack(hours);
            boolean any = false;
            for (String type : CHANGE_TYPES) {
                boolean changed = changes.stream().anyMatch(c ->
                        c.getChangedAt().isAfter(from) && type.equalsIgnoreCase(c.getChangeType()));
                out.put(type + "_change_" + hours + "h", changed);
                any |= changed;
            }
            out.put("any_change_" + hours + "h", any);
        }

        Optional<AccountChange> latest = changes.stream().max(Comparator.comparing(AccountChange::getChangedAt));
        if (!txn.isOutbound() || latest.isEmpty()) {
            out.unknown("last_change_type");
            out.unknown("hours_since_change");
            out.unknown("outbound_since_change");
            out.unknown("is_first_outbound_after_change");
            return;
        }

        Instant changedAt = latest.get().getChangedAt();
        long outboundSince = input.priorOnly(ledger.findTransactions(txn.getAccountId(), changedAt, input.at()))
                .stream().filter(Transaction::isOutbound).count();

        out.put("last_change_type", latest.get().getChangeType().toLowerCase(Locale.ROOT));
        out.put("hours_since_change", SignalInput.hoursBetween(changedAt, input.at()));
        out.put("outbound_since_change", outboundSince);
        out.put("is_first_outbound_after_change", outboundSince == 0);
    }
}
