package com.bank.fraud.exception;

public class AssessmentPersistenceException extends RuntimeException {

    public AssessmentPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
