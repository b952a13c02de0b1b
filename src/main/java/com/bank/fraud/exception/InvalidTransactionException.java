package com.bank.fraud.exception;

/**
 * Rejected input: a required field is missing or the metadata cannot be read.
 * Raised before any history is queried.
 */
public class InvalidTransactionException extends RuntimeException {

    public InvalidTransactionException(String message) {
        super(message);
    }

    public InvalidTransactionException(String message, Throwable cause) {
        super(message, cause);
    }
}
