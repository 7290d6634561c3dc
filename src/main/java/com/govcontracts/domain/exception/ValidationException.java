package com.govcontracts.domain.exception;

/**
 * Thrown for bad or out-of-range request fields. Never retried.
 */
public class ValidationException extends ContractsException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public ValidationException(ErrorKind kind, String message) {
        super(kind, message);
    }
}
