package com.govcontracts.domain.exception;

/**
 * Base exception for query, aggregation, export and task failures.
 */
public class ContractsException extends RuntimeException {

    private final ErrorKind kind;

    public ContractsException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ContractsException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
