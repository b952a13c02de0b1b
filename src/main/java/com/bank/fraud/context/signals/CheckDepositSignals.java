package com.bank.fraud.context.signals;

import com.bank.fraud.config.MonitoringConfig;
import com.bank.fraud.context.SignalGroup;
import com.bank.fraud.context.SignalInput;
import com.bank.fraud.context.SignalWriter;
import com.bank.fraud.ledger.TransactionLedger;
import com.bank.fraud.model.Transaction;
import com.bank.fraud.model.TransactionMetadata;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Duplicate check presentment: the same check number and amount deposited more than once.
 */
@Component
public class CheckDepositSignals implements SignalGroup {

    private static final double AMOUNT_TOLERANCE = 0.01;

    private final TransactionLedger ledger;
    private final MonitoringConfig.Signals config;

    public CheckDepositSignals(TransactionLedger ledger, MonitoringConfig config) {
        this.ledger = ledger;
        this.config = config.getSignals();
    }

    @Override
    public String prefix() {
        return "check";
    }

    @Override
    public void contribute(SignalInput input, SignalWriter out) {
        Transaction txn = input.transaction();
        Optional<String> checkNumber = input.metadata().identifier("check", "check_number");
        boolean checkType = config.getCheckTypes().stream().anyMatch(txn::isType);

        out.put("is_check_deposit", checkType || checkNumber.isPresent());
        if (checkNumber.isEmpty()) {
            out.unknown("duplicate_checks");
            return;
        }

        Optional<Double> statedAmount = input.metadata().number("check", "check_amount");
        double checkAmount = statedAmount.orElse(txn.getAmount());

        out.put("check_number", checkNumber.get());
        out.put("check_amount", checkAmount);
        out.put("amount_mismatch", statedAmount.isPresent()
                && Math.abs(statedAmount.get() - txn.getAmount()) > AMOUNT_TOLERANCE);

        List<Transaction> prior = input.priorOnly(ledger.findTransactions(
                txn.getAccountId(), input.daysBack(config.getCheckLookbackDays()), input.at()));

        List<Map<String, Object>> duplicates = new ArrayList<>();
        long sameNumber = 0;
        for (Transaction t : prior) {
            Optional<TransactionMetadata> metadata = input.metadataOf(t, prefix());
            if (metadata.isEmpty()) continue;
            Optional<String> number = metadata.get().identifier("check", "check_number");
            if (number.isEmpty() || !number.get().equals(checkNumber.get())) continue;

            sameNumber++;
            double amount = metadata.get().number("check", "check_amount").orElse(t.getAmount());
            if (Math.abs(amount - checkAmount) <= AMOUNT_TOLERANCE) {
                Map<String, Object> duplicate = new LinkedHashMap<>();
                duplicate.put("transaction_id", t.getTransactionId());
                duplicate.put("timestamp", t.getTimestamp().toString());
                duplicate.put("amount", amount);
                duplicates.add(duplicate);
            }
        }

        out.put("duplicate_checks", duplicates);
        out.put("is_duplicate_check", !duplicates.isEmpty());
        out.put("same_number_count", sameNumber);
    }
}
