package com.govcontracts.domain.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stop signal for a running export, checked before every batch.
 */
public class ExportCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
