package com.govcontracts.domain.service;

import java.util.UUID;

public class TaskCancelledException extends RuntimeException {

    public TaskCancelledException(UUID taskId) {
        super("Task cancelled: " + taskId);
    }
}
