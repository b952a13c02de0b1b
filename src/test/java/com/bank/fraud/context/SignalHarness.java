package com.bank.fraud.context;

import com.bank.fraud.model.Transaction;
import com.bank.fraud.model.TransactionMetadata;

/**
 * Runs a single signal group outside the assembler, for group-level tests.
 */
public final class SignalHarness {

    private SignalHarness() {}

    public static Context run(SignalGroup group, Transaction txn) {
        SignalInput input = new SignalInput(txn, TransactionMetadata.parse(txn.getMetadata()));
        SignalWriter writer = new SignalWriter(group.prefix());
        group.contribute(input, writer);
        return Context.of(writer.values());
    }
}
