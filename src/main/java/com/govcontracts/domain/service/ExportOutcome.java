package com.govcontracts.domain.service;

import lombok.Value;

@Value
public class ExportOutcome {

    public enum Status {
        COMPLETED,
        CANCELLED
    }

    Status status;
    long rowsWritten;
    int batches;

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }
}
