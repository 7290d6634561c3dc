package com.govcontracts.domain.service;

import com.govcontracts.domain.filter.AggregateSortField;
import com.govcontracts.domain.filter.FilterCompiler;
import com.govcontracts.domain.filter.FilterNode;
import com.govcontracts.domain.filter.SortDirection;
import com.govcontracts.domain.filter.SortSpec;
import com.govcontracts.domain.model.AggregatesRequest;
import com.govcontracts.domain.model.AggregatesResponse;
import com.govcontracts.domain.model.ContractSearchRequest;
import com.govcontracts.domain.model.ContractSearchResponse;
import com.govcontracts.domain.model.FilterOptions;
import com.govcontracts.domain.model.PaginatedAggregatesRequest;
import com.govcontracts.domain.model.PaginatedAggregatesResponse;
import com.govcontracts.domain.model.ValueDistributionRequest;
import com.govcontracts.domain.model.ValueDistributionResponse;
import com.govcontracts.infrastructure.cache.QueryCacheService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Cache-through entry point for the synchronous contract queries.
 *
 * Query Flow:
 * 1. Validate and compile the request (bad sort fields fail here, before any lookup)
 * 2. Generate cache key from the canonical request
 * 3. Check cache (Redis)
 * 4. If cache miss, run the engine
 * 5. Store successful results only
 * 6. Return result
 *
 * Caching Strategy:
 * - Search: 5 minutes
 * - Aggregates, paginated aggregates, value distribution: 10 minutes
 * - Filter options: 24 hours
 *
 * A hit returns exactly what the miss stored, so repeated calls are
 * indistinguishable to the client.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContractQueryService {

    static final String FILTER_OPTIONS_KEY = "contracts:filter-options";

    private final FilterCompiler filterCompiler;
    private final QueryExecutor queryExecutor;
    private final AggregationEngine aggregationEngine;
    private final HistogramEngine histogramEngine;
    private final QueryCacheService cacheService;
    private final MeterRegistry meterRegistry;

    @Value("${app.cache.ttl.search:300}")
    private long searchTtl;

    @Value("${app.cache.ttl.aggregates:600}")
    private long aggregatesTtl;

    @Value("${app.cache.ttl.paginated-aggregates:600}")
    private long paginatedAggregatesTtl;

    @Value("${app.cache.ttl.value-distribution:600}")
    private long valueDistributionTtl;

    @Value("${app.cache.ttl.filter-options:86400}")
    private long filterOptionsTtl;

    public ContractSearchResponse search(ContractSearchRequest request) {
        SortSpec sort = filterCompiler.compileSort(request.getSortBy(), request.getSortDirection());
        FilterNode predicate = filterCompiler.compile(request);

        return cached("search", cacheService.generateCacheKey("contracts:search", request), searchTtl,
                ContractSearchResponse.class, ContractSearchResponse::isSuccess,
                () -> queryExecutor.search(predicate, sort, request.getPage(), request.getPageSize(),
                        request.isIncludeSupplementary()));
    }

    public AggregatesResponse aggregates(AggregatesRequest request) {
        FilterNode predicate = filterCompiler.compile(request);

        return cached("aggregates", cacheService.generateCacheKey("contracts:aggregates", request), aggregatesTtl,
                AggregatesResponse.class, AggregatesResponse::isSuccess,
                () -> aggregationEngine.aggregate(predicate, request.isIncludeSupplementary(), request.getTopN()));
    }

    public PaginatedAggregatesResponse aggregatesPaginated(PaginatedAggregatesRequest request) {
        AggregateSortField sortField = AggregateSortField.resolve(request.getSortBy());
        SortDirection direction = filterCompiler.compileDirection(request.getSortDirection());
        FilterNode predicate = filterCompiler.compile(request);

        return cached("aggregates_paginated",
                cacheService.generateCacheKey("contracts:aggregates:paginated", request), paginatedAggregatesTtl,
                PaginatedAggregatesResponse.class, PaginatedAggregatesResponse::isSuccess,
                () -> aggregationEngine.aggregatePaginated(predicate, request.isIncludeSupplementary(),
                        request.getDimension(), sortField, direction, request.getPage(), request.getPageSize()));
    }

    public ValueDistributionResponse valueDistribution(ValueDistributionRequest request) {
        FilterNode predicate = filterCompiler.compile(request);

        return cached("value_distribution",
                cacheService.generateCacheKey("contracts:value-distribution", request), valueDistributionTtl,
                ValueDistributionResponse.class, ValueDistributionResponse::isSuccess,
                () -> histogramEngine.distribution(predicate, request.isIncludeSupplementary(), request.getNumBins()));
    }

    public FilterOptions filterOptions() {
        return cached("filter_options", cacheService.generateCacheKey(FILTER_OPTIONS_KEY, Map.of()), filterOptionsTtl,
                FilterOptions.class, options -> true, queryExecutor::filterOptions);
    }

    private <T> T cached(String type, String cacheKey, long ttlSeconds, Class<T> resultType,
                         Predicate<T> cacheable, Supplier<T> query) {
        Timer.Sample sample = Timer.start(meterRegistry);

        Optional<T> hit = cacheService.get(cacheKey, resultType);
        if (hit.isPresent()) {
            log.debug("Cache hit for {} query: {}", type, cacheKey);
            Counter.builder("query.cache")
                    .tag("result", "hit")
                    .tag("type", type)
                    .register(meterRegistry)
                    .increment();
            sample.stop(Timer.builder("query.latency")
                    .tag("type", type)
                    .tag("cached", "true")
                    .register(meterRegistry));
            return hit.get();
        }

        log.debug("Cache miss for {} query: {}", type, cacheKey);
        Counter.builder("query.cache")
                .tag("result", "miss")
                .tag("type", type)
                .register(meterRegistry)
                .increment();

        T result = query.get();
        boolean success = cacheable.test(result);
        if (success) {
            cacheService.set(cacheKey, result, ttlSeconds);
        }

        sample.stop(Timer.builder("query.latency")
                .tag("type", type)
                .tag("cached", "false")
                .register(meterRegistry));
        Counter.builder("query.executed")
                .tag("type", type)
                .tag("result", success ? "success" : "error")
                .register(meterRegistry)
                .increment();

        return result;
    }
}
