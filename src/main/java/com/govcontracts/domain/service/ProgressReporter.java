package com.govcontracts.domain.service;

/**
 * Progress sink handed to a running task. Throws
 * {@link TaskCancelledException} once cancellation has been requested.
 */
@FunctionalInterface
public interface ProgressReporter {

    ProgressReporter NONE = (progress, message) -> { };

    void report(int progress, String message);
}
