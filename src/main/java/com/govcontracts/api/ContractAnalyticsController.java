package com.govcontracts.api;

import com.govcontracts.domain.model.AggregatesRequest;
import com.govcontracts.domain.model.AggregatesResponse;
import com.govcontracts.domain.model.ContractSearchRequest;
import com.govcontracts.domain.model.ContractSearchResponse;
import com.govcontracts.domain.model.ExportEstimate;
import com.govcontracts.domain.model.ExportRequest;
import com.govcontracts.domain.model.FilterOptions;
import com.govcontracts.domain.model.PaginatedAggregatesRequest;
import com.govcontracts.domain.model.PaginatedAggregatesResponse;
import com.govcontracts.domain.model.ValueDistributionRequest;
import com.govcontracts.domain.model.ValueDistributionResponse;
import com.govcontracts.domain.service.ContractQueryService;
import com.govcontracts.domain.service.ExportCancellation;
import com.govcontracts.domain.service.ExportProgressListener;
import com.govcontracts.domain.service.ExportService;
import com.govcontracts.infrastructure.dataset.DatasetCatalog;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * REST API for contract analytics.
 *
 * Endpoints:
 * - POST /api/v1/contracts/search - Filtered, sorted, paginated records
 * - POST /api/v1/contracts/aggregates - Summary plus grouped views
 * - POST /api/v1/contracts/aggregates/paginated - One grouped view, paginated
 * - POST /api/v1/contracts/value-distribution - Contract value histogram
 * - POST /api/v1/contracts/export[/aggregated] - CSV download
 * - POST /api/v1/contracts/export[/aggregated]/estimate - CSV size estimate
 * - GET /api/v1/contracts/filter-options - Distinct filter values
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/contracts")
@RequiredArgsConstructor
public class ContractAnalyticsController {

    private static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final ContractQueryService queryService;
    private final ExportService exportService;
    private final DatasetCatalog datasetCatalog;

    /**
     * Search contracts.
     *
     * Body: filter fields plus page, page_size, sortBy, sortDirection.
     * An unknown sort field is rejected with 400 before any query runs.
     */
    @PostMapping("/search")
    public ResponseEntity<ContractSearchResponse> search(@Valid @RequestBody ContractSearchRequest request) {
        log.info("Search contracts: page={}, pageSize={}, sortBy={}", request.getPage(), request.getPageSize(),
                request.getSortBy());
        return ResponseEntity.ok(queryService.search(request));
    }

    @PostMapping("/aggregates")
    public ResponseEntity<AggregatesResponse> aggregates(@Valid @RequestBody AggregatesRequest request) {
        log.info("Aggregates: topN={}", request.getTopN());
        return ResponseEntity.ok(queryService.aggregates(request));
    }

    @PostMapping("/aggregates/paginated")
    public ResponseEntity<PaginatedAggregatesResponse> aggregatesPaginated(
            @Valid @RequestBody PaginatedAggregatesRequest request) {
        log.info("Paginated aggregates: dimension={}, page={}, sortBy={}", request.getDimension(),
                request.getPage(), request.getSortBy());
        return ResponseEntity.ok(queryService.aggregatesPaginated(request));
    }

    @PostMapping("/value-distribution")
    public ResponseEntity<ValueDistributionResponse> valueDistribution(
            @Valid @RequestBody ValueDistributionRequest request) {
        log.info("Value distribution: numBins={}", request.getNumBins());
        return ResponseEntity.ok(queryService.valueDistribution(request));
    }

    @PostMapping("/export/estimate")
    public ResponseEntity<ExportEstimate> estimateExport(@RequestBody ExportRequest request) {
        return ResponseEntity.ok(exportService.estimateRecords(request));
    }

    @PostMapping("/export/aggregated/estimate")
    public ResponseEntity<ExportEstimate> estimateAggregatedExport(@RequestBody ExportRequest request) {
        return ResponseEntity.ok(exportService.estimateAggregated(request));
    }

    /**
     * Stream matching records as CSV. The body is written batch by batch; a
     * client that disconnects stops the export at the next write.
     */
    @PostMapping("/export")
    public ResponseEntity<StreamingResponseBody> export(@RequestBody ExportRequest request) {
        log.info("CSV export requested: includeSupplementary={}", request.isIncludeSupplementary());
        StreamingResponseBody body = out -> exportService.exportRecords(request, out, new ExportCancellation(),
                ExportProgressListener.NONE);
        return csv(ExportService.RECORDS_FILENAME, body);
    }

    @PostMapping("/export/aggregated")
    public ResponseEntity<StreamingResponseBody> exportAggregated(@RequestBody ExportRequest request) {
        log.info("Aggregated CSV export requested: dimension={}", request.getDimension());
        StreamingResponseBody body = out -> exportService.exportAggregated(request, out, new ExportCancellation(),
                ExportProgressListener.NONE);
        return csv(ExportService.aggregatedFilename(request.getDimension()), body);
    }

    @GetMapping("/filter-options")
    public ResponseEntity<FilterOptions> filterOptions() {
        return ResponseEntity.ok(queryService.filterOptions());
    }

    /**
     * Health check endpoint.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "OK",
                "partitions", datasetCatalog.partitions().size()));
    }

    private ResponseEntity<StreamingResponseBody> csv(String filename, StreamingResponseBody body) {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=" + filename)
                .contentType(TEXT_CSV)
                .body(body);
    }
}
