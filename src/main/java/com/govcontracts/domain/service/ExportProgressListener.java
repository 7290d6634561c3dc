package com.govcontracts.domain.service;

/**
 * Called after each batch has been written and flushed.
 */
@FunctionalInterface
public interface ExportProgressListener {

    ExportProgressListener NONE = (rowsWritten, batches) -> { };

    void batchWritten(long rowsWritten, int batches);
}
