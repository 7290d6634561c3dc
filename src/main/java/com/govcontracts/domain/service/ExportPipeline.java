package com.govcontracts.domain.service;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.govcontracts.domain.exception.ExportException;
import com.govcontracts.domain.exception.ValidationException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Streams CSV from a {@link BatchSource} with memory bounded by one batch.
 *
 * Flow:
 * 1. Write the optional UTF-8 BOM and the header row
 * 2. Fetch a batch (retried on transient failure)
 * 3. Write and flush the batch, then report progress
 * 4. Repeat until a batch comes back short or empty
 *
 * Stop conditions:
 * - {@link ExportCancellation#cancel()} before the next fetch: CANCELLED
 * - IOException on write or flush (the consumer went away): CANCELLED
 * - Fetch still failing after the retry budget: {@link ExportException}
 */
@Slf4j
@Component
public class ExportPipeline {

    static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    private final CsvMapper csvMapper = CsvMapper.builder()
            .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
            .build();

    @Value("${app.export.batch-size:1000}")
    private int batchSize;

    @Value("${app.export.retry.max-attempts:3}")
    private int retryAttempts;

    @Value("${app.export.retry.wait-ms:500}")
    private long retryWaitMs;

    public <S, R> ExportOutcome stream(BatchSource<S> source, Function<S, R> toRow, Class<R> rowType,
                                       OutputStream out, boolean bom, ExportCancellation cancellation,
                                       ExportProgressListener listener) {
        CsvSchema schema = csvMapper.schemaFor(rowType).withoutHeader();
        Retry retry = newRetry();
        long rowsWritten = 0;
        int batches = 0;
        SequenceWriter writer = null;

        try {
            if (bom) {
                out.write(UTF8_BOM);
            }
            out.write(headerBytes(rowType));
            out.flush();
            writer = csvMapper.writer(schema).writeValues(out);

            long offset = 0;
            while (true) {
                if (cancellation.isCancelled()) {
                    log.info("Export cancelled after {} rows in {} batches", rowsWritten, batches);
                    return new ExportOutcome(ExportOutcome.Status.CANCELLED, rowsWritten, batches);
                }

                List<S> batch = fetch(retry, source, offset, rowsWritten);
                if (batch.isEmpty()) {
                    break;
                }

                for (S item : batch) {
                    writer.write(toRow.apply(item));
                }
                writer.flush();

                rowsWritten += batch.size();
                offset += batch.size();
                batches++;
                listener.batchWritten(rowsWritten, batches);

                if (batch.size() < batchSize) {
                    break;
                }
            }

            log.info("Export completed: {} rows in {} batches", rowsWritten, batches);
            return new ExportOutcome(ExportOutcome.Status.COMPLETED, rowsWritten, batches);

        } catch (JsonProcessingException e) {
            throw new ExportException("CSV serialization failed after " + rowsWritten + " rows", e);
        } catch (IOException e) {
            log.info("Export consumer disconnected after {} rows: {}", rowsWritten, e.getMessage());
            return new ExportOutcome(ExportOutcome.Status.CANCELLED, rowsWritten, batches);
        } finally {
            closeQuietly(writer);
        }
    }

    public int getBatchSize() {
        return batchSize;
    }

    public byte[] headerBytes(Class<?> rowType) {
        List<String> names = new ArrayList<>();
        csvMapper.schemaFor(rowType).forEach(column -> names.add(column.getName()));
        return (String.join(",", names) + "\n").getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Average serialized size of the given rows, in bytes.
     */
    public double averageRowBytes(List<?> rows, Class<?> rowType) {
        if (rows.isEmpty()) {
            return 0;
        }
        try {
            byte[] bytes = csvMapper.writer(csvMapper.schemaFor(rowType).withoutHeader()).writeValueAsBytes(rows);
            return (double) bytes.length / rows.size();
        } catch (JsonProcessingException e) {
            throw new ExportException("Could not serialize sample rows", e);
        }
    }

    private <S> List<S> fetch(Retry retry, BatchSource<S> source, long offset, long rowsWritten) {
        try {
            return retry.executeSupplier(() -> source.fetch(offset, batchSize));
        } catch (ValidationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Export fetch failed at offset {} after {} attempts; {} rows written: {}",
                    offset, retryAttempts, rowsWritten, e.getMessage(), e);
            throw new ExportException("Export fetch failed at offset " + offset + " after "
                    + retryAttempts + " attempts: " + e.getMessage(), e);
        }
    }

    private Retry newRetry() {
        return Retry.of("export-fetch", RetryConfig.custom()
                .maxAttempts(retryAttempts)
                .waitDuration(Duration.ofMillis(retryWaitMs))
                .ignoreExceptions(ValidationException.class)
                .build());
    }

    private void closeQuietly(SequenceWriter writer) {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
        } catch (IOException e) {
            log.debug("Ignoring error closing CSV writer: {}", e.getMessage());
        }
    }
}
