package com.govcontracts.domain.exception;

public class AggregationException extends ContractsException {

    public AggregationException(String message) {
        super(ErrorKind.AGGREGATION, message);
    }

    public AggregationException(String message, Throwable cause) {
        super(ErrorKind.AGGREGATION, message, cause);
    }
}
