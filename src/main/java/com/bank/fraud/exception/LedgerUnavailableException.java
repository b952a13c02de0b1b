package com.bank.fraud.exception;

/**
 * The transaction ledger could not be queried. Always fatal to an evaluation:
 * no assessment is produced from partial or stale history.
 */
public class LedgerUnavailableException extends RuntimeException {

    public LedgerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
