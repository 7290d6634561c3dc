package com.govcontracts.domain.exception;

public class SearchException extends ContractsException {

    public SearchException(String message) {
        super(ErrorKind.SEARCH, message);
    }

    public SearchException(String message, Throwable cause) {
        super(ErrorKind.SEARCH, message, cause);
    }

    public SearchException(ErrorKind kind, String message) {
        super(kind, message);
    }
}
