package com.govcontracts.domain.model;

public enum TaskState {
    PENDING,
    STARTED,
    PROGRESS,
    RETRY,
    SUCCESS,
    FAILURE;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILURE;
    }

    public boolean isRunning() {
        return this == STARTED || this == PROGRESS;
    }
}
