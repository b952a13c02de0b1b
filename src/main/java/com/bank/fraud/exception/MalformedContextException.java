package com.bank.fraud.exception;

/**
 * A signal is present in the context but holds a value of the wrong type.
 */
public class MalformedContextException extends RuntimeException {

    public MalformedContextException(String message) {
        super(message);
    }

    public MalformedContextException(String message, Throwable cause) {
        super(message, cause);
    }
}
