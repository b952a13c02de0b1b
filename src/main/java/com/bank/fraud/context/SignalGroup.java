package com.bank.fraud.context;

/**
 * One independently computable family of signals.
 *
 * Implementations read only the raw transaction and the ledger; they never look at
 * another group's output, which is what allows the assembler to run them in parallel.
 * Missing optional data is written as unknown. Ledger outages propagate.
 */
public interface SignalGroup {

    /**
     * Key prefix owned by this group. Must be unique across the assembler.
     */
    String prefix();

    void contribute(SignalInput input, SignalWriter out);
}
