package com.govcontracts.domain.exception;

/**
 * Raised when an export cannot be completed, typically after the fetch
 * retry budget is exhausted.
 */
public class ExportException extends ContractsException {

    public ExportException(String message) {
        super(ErrorKind.EXPORT, message);
    }

    public ExportException(String message, Throwable cause) {
        super(ErrorKind.EXPORT, message, cause);
    }
}
