package com.govcontracts.domain.service;

import com.govcontracts.domain.exception.ExportException;
import com.govcontracts.domain.filter.FilterCompiler;
import com.govcontracts.domain.filter.FilterNode;
import com.govcontracts.domain.model.AggregateCsvRow;
import com.govcontracts.domain.model.AggregateDimension;
import com.govcontracts.domain.model.AggregateRow;
import com.govcontracts.domain.model.ContractCsvRow;
import com.govcontracts.domain.model.ContractRecord;
import com.govcontracts.domain.model.ExportEstimate;
import com.govcontracts.domain.model.ExportRequest;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Locale;

/**
 * Record and aggregate CSV exports, their size estimates, and file exports
 * for background tasks.
 *
 * Record exports read the filtered union unsorted and without a count.
 * Aggregate exports page the grouped rows in total_value DESC, label ASC
 * order so paging over groups is deterministic.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExportService {

    public static final String RECORDS_FILENAME = "contracts_export.csv";

    static final int RECORD_ROW_BYTES_FALLBACK = 250;
    static final int AGGREGATE_ROW_BYTES_FALLBACK = 120;

    private final FilterCompiler filterCompiler;
    private final QueryExecutor queryExecutor;
    private final AggregationEngine aggregationEngine;
    private final ExportPipeline exportPipeline;
    private final MeterRegistry meterRegistry;

    @Value("${app.export.estimate-sample-size:200}")
    private int estimateSampleSize;

    @Value("${app.export.dir:exports}")
    private String exportDir;

    public static String aggregatedFilename(AggregateDimension dimension) {
        return dimension.exportName() + "_export.csv";
    }

    public ExportOutcome exportRecords(ExportRequest request, OutputStream out, ExportCancellation cancellation,
                                       ExportProgressListener listener) {
        FilterNode predicate = filterCompiler.compile(request);
        boolean include = request.isIncludeSupplementary();
        ExportOutcome outcome = exportPipeline.stream(
                (offset, limit) -> queryExecutor.fetchBatch(predicate, include, offset, limit),
                ContractCsvRow::from, ContractCsvRow.class, out, request.isBom(), cancellation, listener);
        record("records", outcome);
        return outcome;
    }

    public ExportOutcome exportAggregated(ExportRequest request, OutputStream out, ExportCancellation cancellation,
                                          ExportProgressListener listener) {
        FilterNode predicate = filterCompiler.compile(request);
        boolean include = request.isIncludeSupplementary();
        AggregateDimension dimension = request.getDimension();
        ExportOutcome outcome = exportPipeline.stream(
                (offset, limit) -> aggregationEngine.fetchGroupBatch(predicate, include, dimension, offset, limit),
                AggregateCsvRow::from, AggregateCsvRow.class, out, request.isBom(), cancellation, listener);
        record("aggregated", outcome);
        return outcome;
    }

    public long countRecords(ExportRequest request) {
        return queryExecutor.count(filterCompiler.compile(request), request.isIncludeSupplementary());
    }

    /**
     * Row count plus projected CSV size, from a count query and a small
     * serialized sample.
     */
    public ExportEstimate estimateRecords(ExportRequest request) {
        FilterNode predicate = filterCompiler.compile(request);
        boolean include = request.isIncludeSupplementary();
        long total = queryExecutor.count(predicate, include);
        List<ContractRecord> sample = total == 0
                ? List.of()
                : queryExecutor.fetchBatch(predicate, include, 0, estimateSampleSize);
        List<ContractCsvRow> rows = sample.stream().map(ContractCsvRow::from).toList();
        return estimate(total, rows, ContractCsvRow.class, RECORD_ROW_BYTES_FALLBACK);
    }

    public ExportEstimate estimateAggregated(ExportRequest request) {
        FilterNode predicate = filterCompiler.compile(request);
        boolean include = request.isIncludeSupplementary();
        AggregateDimension dimension = request.getDimension();
        long total = aggregationEngine.countGroups(predicate, include, dimension);
        List<AggregateRow> sample = total == 0
                ? List.of()
                : aggregationEngine.fetchGroupBatch(predicate, include, dimension, 0, estimateSampleSize);
        List<AggregateCsvRow> rows = sample.stream().map(AggregateCsvRow::from).toList();
        return estimate(total, rows, AggregateCsvRow.class, AGGREGATE_ROW_BYTES_FALLBACK);
    }

    /**
     * Write a record export to the export directory. The file appears under
     * its final name only once complete.
     *
     * @return path of the written file
     */
    public Path exportRecordsToFile(String name, ExportRequest request, ExportCancellation cancellation,
                                    ExportProgressListener listener) {
        Path dir = Paths.get(exportDir);
        Path target = dir.resolve(name);
        Path partial = dir.resolve(name + ".part");
        try {
            Files.createDirectories(dir);
            ExportOutcome outcome;
            try (OutputStream out = Files.newOutputStream(partial)) {
                outcome = exportRecords(request, out, cancellation, listener);
            }
            if (!outcome.isCompleted()) {
                throw new ExportException("Export to " + target + " was cancelled after " + outcome.getRowsWritten() + " rows");
            }
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
            log.info("Export file written: {} ({} rows)", target, outcome.getRowsWritten());
            return target;
        } catch (IOException e) {
            deletePartial(partial);
            throw new ExportException("Could not write export file " + target + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            deletePartial(partial);
            throw e;
        }
    }

    private void deletePartial(Path partial) {
        try {
            Files.deleteIfExists(partial);
        } catch (IOException e) {
            log.warn("Could not delete partial export {}: {}", partial, e.getMessage());
        }
    }

    private ExportEstimate estimate(long total, List<?> sample, Class<?> rowType, int fallbackRowBytes) {
        boolean sampled = !sample.isEmpty();
        double avgRowBytes = sampled ? exportPipeline.averageRowBytes(sample, rowType) : fallbackRowBytes;
        long headerBytes = exportPipeline.headerBytes(rowType).length;
        return ExportEstimate.builder()
                .totalCount(total)
                .estimatedCsvBytes(headerBytes + Math.round(total * avgRowBytes))
                .avgRowBytes(avgRowBytes)
                .sampled(sampled)
                .build();
    }

    private void record(String kind, ExportOutcome outcome) {
        Counter.builder("export.rows")
                .tag("kind", kind)
                .tag("status", outcome.getStatus().name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment(outcome.getRowsWritten());
    }
}
