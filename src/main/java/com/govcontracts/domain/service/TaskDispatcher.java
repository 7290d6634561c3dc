package com.govcontracts.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.govcontracts.domain.exception.AggregationException;
import com.govcontracts.domain.exception.SearchException;
import com.govcontracts.domain.exception.ValidationException;
import com.govcontracts.domain.filter.AggregateSortField;
import com.govcontracts.domain.filter.FilterCompiler;
import com.govcontracts.domain.model.AggregatesRequest;
import com.govcontracts.domain.model.AggregatesResponse;
import com.govcontracts.domain.model.ContractSearchRequest;
import com.govcontracts.domain.model.ContractSearchResponse;
import com.govcontracts.domain.model.ExportFileResult;
import com.govcontracts.domain.model.ExportRequest;
import com.govcontracts.domain.model.FilterRequest;
import com.govcontracts.domain.model.PaginatedAggregatesRequest;
import com.govcontracts.domain.model.PaginatedAggregatesResponse;
import com.govcontracts.domain.model.TaskKind;
import com.govcontracts.domain.model.ValueDistributionRequest;
import com.govcontracts.domain.model.ValueDistributionResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Locale;
import java.util.UUID;

/**
 * Runs one attempt of a task by kind.
 *
 * Structured failures from the query services ({@code success=false}) are
 * raised as exceptions here so the orchestrator can retry them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TaskDispatcher {

    private final ContractQueryService queryService;
    private final ExportService exportService;
    private final FilterCompiler filterCompiler;
    private final ObjectMapper objectMapper;

    /**
     * Bind raw params to the request type of the kind and check what can be
     * checked before queueing.
     */
    public Object readParams(TaskKind kind, JsonNode params) {
        JsonNode source = params == null || params.isNull() ? objectMapper.createObjectNode() : params;
        Object request;
        try {
            request = objectMapper.treeToValue(source, kind.paramsType());
        } catch (JsonProcessingException e) {
            throw new ValidationException("Invalid params for " + kind + ": " + e.getOriginalMessage());
        }
        validate(kind, request);
        return request;
    }

    public Object readParams(TaskKind kind, String params) {
        try {
            return readParams(kind, objectMapper.readTree(params));
        } catch (JsonProcessingException e) {
            throw new ValidationException("Invalid params for " + kind + ": " + e.getOriginalMessage());
        }
    }

    public Object dispatch(UUID taskId, TaskKind kind, Object params, ProgressReporter reporter) {
        reporter.report(5, "Running " + kind.name().toLowerCase(Locale.ROOT));

        return switch (kind) {
            case SEARCH -> {
                ContractSearchResponse response = queryService.search((ContractSearchRequest) params);
                if (!response.isSuccess()) {
                    throw new SearchException(response.getError());
                }
                yield response;
            }
            case AGGREGATES -> {
                AggregatesResponse response = queryService.aggregates((AggregatesRequest) params);
                if (!response.isSuccess()) {
                    throw new AggregationException(response.getError());
                }
                yield response;
            }
            case AGGREGATES_PAGINATED -> {
                PaginatedAggregatesResponse response =
                        queryService.aggregatesPaginated((PaginatedAggregatesRequest) params);
                if (!response.isSuccess()) {
                    throw new AggregationException(response.getError());
                }
                yield response;
            }
            case VALUE_DISTRIBUTION -> {
                ValueDistributionResponse response =
                        queryService.valueDistribution((ValueDistributionRequest) params);
                if (!response.isSuccess()) {
                    throw new AggregationException(response.getError());
                }
                yield response;
            }
            case FILTER_OPTIONS -> queryService.filterOptions();
            case EXPORT_CSV -> exportToFile(taskId, (ExportRequest) params, reporter);
        };
    }

    private ExportFileResult exportToFile(UUID taskId, ExportRequest request, ProgressReporter reporter) {
        long total = exportService.countRecords(request);
        reporter.report(10, "Exporting " + total + " rows");

        String fileName = "contracts_export_" + taskId + ".csv";
        long[] written = {0};
        Path path = exportService.exportRecordsToFile(fileName, request, new ExportCancellation(),
                (rowsWritten, batches) -> {
                    written[0] = rowsWritten;
                    int progress = total == 0 ? 99 : (int) Math.min(99, 10 + rowsWritten * 89 / total);
                    reporter.report(progress, "Exported " + rowsWritten + " of " + total + " rows");
                });

        log.info("Task {} exported {} rows to {}", taskId, written[0], path);
        return ExportFileResult.builder()
                .fileName(fileName)
                .path(path.toString())
                .rowsWritten(written[0])
                .build();
    }

    private void validate(TaskKind kind, Object request) {
        switch (kind) {
            case SEARCH -> {
                ContractSearchRequest search = (ContractSearchRequest) request;
                filterCompiler.compileSort(search.getSortBy(), search.getSortDirection());
                QueryExecutor.validatePage(search.getPage(), search.getPageSize());
            }
            case AGGREGATES_PAGINATED -> {
                PaginatedAggregatesRequest paginated = (PaginatedAggregatesRequest) request;
                AggregateSortField.resolve(paginated.getSortBy());
                filterCompiler.compileDirection(paginated.getSortDirection());
                QueryExecutor.validatePage(paginated.getPage(), paginated.getPageSize());
            }
            case VALUE_DISTRIBUTION -> HistogramEngine.validateBins(((ValueDistributionRequest) request).getNumBins());
            default -> {
            }
        }
        if (request instanceof FilterRequest filter) {
            filterCompiler.compile(filter);
        }
    }
}
