package com.govcontracts.domain.service;

import com.govcontracts.domain.exception.ExportException;
import com.govcontracts.domain.exception.SearchException;
import com.govcontracts.domain.exception.ValidationException;
import com.govcontracts.domain.model.AggregateCsvRow;
import com.govcontracts.domain.model.AggregateRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ExportPipeline.
 *
 * Sources are generated in memory so large exports stay cheap.
 */
class ExportPipelineTest {

    private static final int BATCH_SIZE = 10;
    private static final String HEADER = "label,total_value,count,avg_value\n";

    private ExportPipeline pipeline;

    @BeforeEach
    void setUp() {
        pipeline = new ExportPipeline();
        ReflectionTestUtils.setField(pipeline, "batchSize", BATCH_SIZE);
        ReflectionTestUtils.setField(pipeline, "retryAttempts", 3);
        ReflectionTestUtils.setField(pipeline, "retryWaitMs", 1L);
    }

    @Test
    void testStream_LargeExportInBoundedBatches() {
        // Given
        int total = BATCH_SIZE * 100 + 7;
        GeneratedSource source = new GeneratedSource(total);
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        // When
        ExportOutcome outcome = stream(source, out, false, new ExportCancellation(), ExportProgressListener.NONE);

        // Then
        assertTrue(outcome.isCompleted());
        assertEquals(total, outcome.getRowsWritten());
        assertEquals(101, outcome.getBatches());
        assertEquals(BATCH_SIZE, source.largestLimit);
        String csv = out.toString(StandardCharsets.UTF_8);
        assertTrue(csv.startsWith(HEADER));
        assertEquals(total + 1, csv.split("\n").length);
    }

    @Test
    void testStream_EmptyExportStillHasHeader() {
        // Given
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        // When
        ExportOutcome outcome = stream(new GeneratedSource(0), out, true, new ExportCancellation(),
                ExportProgressListener.NONE);

        // Then
        assertTrue(outcome.isCompleted());
        assertEquals(0, outcome.getRowsWritten());
        byte[] bytes = out.toByteArray();
        assertArrayEquals(ExportPipeline.UTF8_BOM, Arrays.copyOf(bytes, 3));
        assertEquals(HEADER, new String(bytes, 3, bytes.length - 3, StandardCharsets.UTF_8));
    }

    @Test
    void testStream_CancelStopsBeforeNextBatch() {
        // Given
        ExportCancellation cancellation = new ExportCancellation();
        GeneratedSource source = new GeneratedSource(1000);
        ExportProgressListener listener = (rows, batches) -> {
            if (batches == 3) {
                cancellation.cancel();
            }
        };

        // When
        ExportOutcome outcome = stream(source, new ByteArrayOutputStream(), false, cancellation, listener);

        // Then
        assertEquals(ExportOutcome.Status.CANCELLED, outcome.getStatus());
        assertEquals(3 * BATCH_SIZE, outcome.getRowsWritten());
        assertEquals(3, source.fetches.get());
    }

    @Test
    void testStream_ConsumerDisconnectEndsAsCancelled() {
        // Given
        GeneratedSource source = new GeneratedSource(10_000);
        OutputStream broken = new FailingOutputStream(2_000);

        // When
        ExportOutcome outcome = stream(source, broken, false, new ExportCancellation(), ExportProgressListener.NONE);

        // Then
        assertEquals(ExportOutcome.Status.CANCELLED, outcome.getStatus());
        assertTrue(outcome.getRowsWritten() < 10_000);
        assertTrue(source.fetches.get() < 1_000);
    }

    @Test
    void testStream_TransientFetchFailureIsRetried() {
        // Given
        GeneratedSource source = new GeneratedSource(25);
        source.failuresBeforeSuccess = 2;

        // When
        ExportOutcome outcome = stream(source, new ByteArrayOutputStream(), false, new ExportCancellation(),
                ExportProgressListener.NONE);

        // Then
        assertTrue(outcome.isCompleted());
        assertEquals(25, outcome.getRowsWritten());
    }

    @Test
    void testStream_RetryExhaustionFailsExport() {
        // Given
        GeneratedSource source = new GeneratedSource(25);
        source.failuresBeforeSuccess = Integer.MAX_VALUE;

        // When
        ExportException e = assertThrows(ExportException.class, () -> stream(source, new ByteArrayOutputStream(),
                false, new ExportCancellation(), ExportProgressListener.NONE));

        // Then
        assertTrue(e.getMessage().contains("offset 0"));
        assertEquals(3, source.fetches.get());
    }

    @Test
    void testStream_ValidationErrorIsNotRetried() {
        // Given
        BatchSource<AggregateRow> invalid = (offset, limit) -> {
            throw new ValidationException("bad filter");
        };

        // When / Then
        assertThrows(ValidationException.class, () -> pipeline.stream(invalid, AggregateCsvRow::from,
                AggregateCsvRow.class, new ByteArrayOutputStream(), false, new ExportCancellation(),
                ExportProgressListener.NONE));
    }

    @Test
    void testAverageRowBytes() {
        // Given
        List<AggregateCsvRow> rows = List.of(new AggregateCsvRow("ab", 1.0, 1, 1.0));

        // When
        double avg = pipeline.averageRowBytes(rows, AggregateCsvRow.class);

        // Then
        assertEquals("ab,1.0,1,1.0\n".length(), avg, 0.001);
    }

    private ExportOutcome stream(BatchSource<AggregateRow> source, OutputStream out, boolean bom,
                                 ExportCancellation cancellation, ExportProgressListener listener) {
        return pipeline.stream(source, AggregateCsvRow::from, AggregateCsvRow.class, out, bom, cancellation, listener);
    }

    private static final class GeneratedSource implements BatchSource<AggregateRow> {

        private final int total;
        private final AtomicInteger fetches = new AtomicInteger();
        private int failuresBeforeSuccess;
        private int largestLimit;

        private GeneratedSource(int total) {
            this.total = total;
        }

        @Override
        public List<AggregateRow> fetch(long offset, int limit) {
            fetches.incrementAndGet();
            if (failuresBeforeSuccess > 0) {
                failuresBeforeSuccess--;
                throw new SearchException("transient");
            }
            largestLimit = Math.max(largestLimit, limit);
            List<AggregateRow> rows = new ArrayList<>();
            for (long i = offset; i < Math.min(total, offset + limit); i++) {
                rows.add(AggregateRow.builder().label("group-" + i).totalValue((double) i).count(1).avgValue((double) i).build());
            }
            return rows;
        }
    }

    private static final class FailingOutputStream extends OutputStream {

        private final int limit;
        private int written;

        private FailingOutputStream(int limit) {
            this.limit = limit;
        }

        @Override
        public void write(int b) throws IOException {
            if (++written > limit) {
                throw new IOException("Broken pipe");
            }
        }
    }
}
