package com.govcontracts.domain.model;

/**
 * Work a background task can run. Each kind names the request type its
 * params deserialize into.
 */
public enum TaskKind {
    SEARCH(ContractSearchRequest.class),
    AGGREGATES(AggregatesRequest.class),
    AGGREGATES_PAGINATED(PaginatedAggregatesRequest.class),
    VALUE_DISTRIBUTION(ValueDistributionRequest.class),
    FILTER_OPTIONS(FilterRequest.class),
    EXPORT_CSV(ExportRequest.class);

    private final Class<?> paramsType;

    TaskKind(Class<?> paramsType) {
        this.paramsType = paramsType;
    }

    public Class<?> paramsType() {
        return paramsType;
    }
}
