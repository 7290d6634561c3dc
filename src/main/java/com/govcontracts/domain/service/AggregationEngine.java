package com.govcontracts.domain.service;

import com.govcontracts.domain.exception.AggregationException;
import com.govcontracts.domain.exception.ContractsException;
import com.govcontracts.domain.exception.ValidationException;
import com.govcontracts.domain.filter.AggregateSortField;
import com.govcontracts.domain.filter.FilterNode;
import com.govcontracts.domain.filter.MatchAll;
import com.govcontracts.domain.filter.SortDirection;
import com.govcontracts.domain.filter.SqlFragment;
import com.govcontracts.domain.filter.SqlPredicateRenderer;
import com.govcontracts.domain.model.AggregateDimension;
import com.govcontracts.domain.model.AggregateRow;
import com.govcontracts.domain.model.AggregateSummary;
import com.govcontracts.domain.model.AggregatesResponse;
import com.govcontracts.domain.model.MonthlyTotal;
import com.govcontracts.domain.model.PaginatedAggregatesResponse;
import com.govcontracts.domain.model.Pagination;
import com.govcontracts.domain.model.YearlyTotal;
import com.govcontracts.infrastructure.dataset.DatasetCatalog;
import com.govcontracts.infrastructure.dataset.DuckDbEngine;
import com.govcontracts.infrastructure.dataset.Partition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Grouped rollups over the filtered contract set.
 *
 * Multi-view aggregates:
 * 1. Copy the filtered scan once into a session temp table
 * 2. Compute the summary, yearly, monthly and top-N views from it
 * 3. A failing view is logged and returned empty; the others still succeed
 *
 * Paginated aggregates group one dimension and page the groups with the same
 * count-and-page-in-one-statement approach as record search. When nothing is
 * filtered and the supplementary partition is not requested, the precomputed
 * {@code agg_<entity>} partition answers instead of a full scan.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AggregationEngine {

    static final String SOURCE_SCAN = "scan";
    static final String SOURCE_PRECOMPUTED = "precomputed";

    private static final String SCOPE_TABLE = "agg_scope";

    private static final RowMapper<AggregateRow> GROUP_ROW = (rs, rowNum) -> AggregateRow.builder()
            .label(rs.getString("label"))
            .totalValue(nullableDouble(rs.getObject("total_value")))
            .count(rs.getLong("count"))
            .avgValue(nullableDouble(rs.getObject("avg_value")))
            .build();

    private final DuckDbEngine engine;
    private final DatasetCatalog catalog;

    @Value("${app.dataset.supplementary-marker:flood}")
    private String supplementaryMarker;

    @Value("${app.aggregates.use-precomputed:true}")
    private boolean usePrecomputed;

    public AggregatesResponse aggregate(FilterNode predicate, boolean includeSupplementary, int topN) {
        if (topN < 1 || topN > 1000) {
            throw new ValidationException("topN must be between 1 and 1000, got " + topN);
        }
        long startTime = System.currentTimeMillis();

        try {
            Optional<String> union = catalog.unionSql(includeSupplementary);
            if (union.isEmpty()) {
                return AggregatesResponse.empty();
            }
            SqlFragment where = SqlPredicateRenderer.render(predicate);

            AggregatesResponse response = engine.withSession(jdbc -> {
                jdbc.execute("CREATE OR REPLACE TEMP TABLE " + SCOPE_TABLE + " (award_date DATE, awardee_name VARCHAR, "
                        + "organization_name VARCHAR, area_of_delivery VARCHAR, business_category VARCHAR, amount DOUBLE)");
                jdbc.update("INSERT INTO " + SCOPE_TABLE + " SELECT award_date, awardee_name, organization_name, "
                        + "area_of_delivery, business_category, CAST(contract_amount AS DOUBLE) "
                        + "FROM (" + union.get() + ") c WHERE " + where.getSql(), where.paramArray());

                return AggregatesResponse.builder()
                        .success(true)
                        .summary(view("summary", AggregateSummary.empty(), () -> summary(jdbc)))
                        .byYear(view("by_year", List.of(), () -> byYear(jdbc)))
                        .byMonth(view("by_month", List.of(), () -> byMonth(jdbc)))
                        .byContractor(view("by_contractor", List.of(), () -> topN(jdbc, AggregateDimension.BY_CONTRACTOR, topN)))
                        .byOrganization(view("by_organization", List.of(), () -> topN(jdbc, AggregateDimension.BY_ORGANIZATION, topN)))
                        .byArea(view("by_area", List.of(), () -> topN(jdbc, AggregateDimension.BY_AREA, topN)))
                        .byCategory(view("by_category", List.of(), () -> topN(jdbc, AggregateDimension.BY_CATEGORY, topN)))
                        .build();
            });

            log.info("Aggregates computed: {} contracts, top {}, {} ms",
                    response.getSummary().getCount(), topN, System.currentTimeMillis() - startTime);
            return response;

        } catch (Exception e) {
            log.error("Error computing aggregates: {}", e.getMessage(), e);
            return AggregatesResponse.failure(e.getMessage());
        }
    }

    public PaginatedAggregatesResponse aggregatePaginated(FilterNode predicate, boolean includeSupplementary,
                                                          AggregateDimension dimension, AggregateSortField sortField,
                                                          SortDirection direction, int page, int pageSize) {
        QueryExecutor.validatePage(page, pageSize);
        long startTime = System.currentTimeMillis();

        try {
            if (usePrecomputed && predicate instanceof MatchAll && !includeSupplementary) {
                Optional<Partition> precomputed = catalog.aggregatePartition(dimension.entity());
                if (precomputed.isPresent()) {
                    try {
                        List<Object> params = new ArrayList<>();
                        PaginatedAggregatesResponse response = pageGroups(precomputedGroups(precomputed.get(), params),
                                params, dimension, sortField, direction, page, pageSize, SOURCE_PRECOMPUTED);
                        log.info("Paginated aggregate {} served from {} in {} ms", dimension.key(),
                                precomputed.get().getPath().getFileName(), System.currentTimeMillis() - startTime);
                        return response;
                    } catch (Exception e) {
                        log.warn("Precomputed partition {} unusable, falling back to scan: {}",
                                precomputed.get().getId(), e.getMessage());
                    }
                }
            }

            Optional<String> union = catalog.unionSql(includeSupplementary);
            if (union.isEmpty()) {
                return PaginatedAggregatesResponse.builder()
                        .success(true)
                        .dimension(dimension)
                        .data(List.of())
                        .pagination(Pagination.empty(page, pageSize))
                        .source(SOURCE_SCAN)
                        .build();
            }

            List<Object> params = new ArrayList<>();
            String grouped = scannedGroups(union.get(), predicate, includeSupplementary, dimension, params);
            PaginatedAggregatesResponse response = pageGroups(grouped, params, dimension, sortField, direction,
                    page, pageSize, SOURCE_SCAN);

            log.info("Paginated aggregate {} computed: {} groups, page {}, {} ms", dimension.key(),
                    response.getPagination().getTotalCount(), page, System.currentTimeMillis() - startTime);
            return response;

        } catch (Exception e) {
            log.error("Error computing paginated aggregate {}: {}", dimension.key(), e.getMessage(), e);
            return PaginatedAggregatesResponse.failure(dimension, page, pageSize, e.getMessage());
        }
    }

    /**
     * Groups {@code [offset, offset + limit)} in export order
     * (total_value DESC, label ASC), without a count.
     */
    public List<AggregateRow> fetchGroupBatch(FilterNode predicate, boolean includeSupplementary,
                                              AggregateDimension dimension, long offset, int limit) {
        try {
            Optional<String> union = catalog.unionSql(includeSupplementary);
            if (union.isEmpty()) {
                return List.of();
            }
            List<Object> params = new ArrayList<>();
            String grouped = scannedGroups(union.get(), predicate, includeSupplementary, dimension, params);
            String sql = "SELECT * FROM (" + grouped + ") g ORDER BY "
                    + AggregateSortField.TOTAL_VALUE.orderBy(SortDirection.DESC, "g")
                    + " LIMIT " + limit + " OFFSET " + offset;
            return engine.jdbc().query(sql, GROUP_ROW, params.toArray());
        } catch (ContractsException e) {
            throw e;
        } catch (Exception e) {
            throw new AggregationException("Group batch read failed at offset " + offset + ": " + e.getMessage(), e);
        }
    }

    public long countGroups(FilterNode predicate, boolean includeSupplementary, AggregateDimension dimension) {
        try {
            Optional<String> union = catalog.unionSql(includeSupplementary);
            if (union.isEmpty()) {
                return 0;
            }
            List<Object> params = new ArrayList<>();
            String grouped = scannedGroups(union.get(), predicate, includeSupplementary, dimension, params);
            Long count = engine.jdbc().queryForObject("SELECT COUNT(*) FROM (" + grouped + ") g",
                    Long.class, params.toArray());
            return count == null ? 0 : count;
        } catch (ContractsException e) {
            throw e;
        } catch (Exception e) {
            throw new AggregationException("Group count failed: " + e.getMessage(), e);
        }
    }

    private String scannedGroups(String union, FilterNode predicate, boolean includeSupplementary,
                                 AggregateDimension dimension, List<Object> params) {
        SqlFragment where = SqlPredicateRenderer.render(predicate);
        params.addAll(where.getParams());
        String column = dimension.column();
        StringBuilder sql = new StringBuilder()
                .append("SELECT ").append(column).append(" AS label, ")
                .append("SUM(CAST(contract_amount AS DOUBLE)) AS total_value, ")
                .append("COUNT(*) AS count, ")
                .append("AVG(CAST(contract_amount AS DOUBLE)) AS avg_value ")
                .append("FROM (").append(union).append(") c WHERE ").append(where.getSql())
                .append(" AND ").append(column).append(" IS NOT NULL");
        appendMarkerExclusion(sql, column, includeSupplementary, params);
        return sql.append(" GROUP BY ").append(column).toString();
    }

    private String precomputedGroups(Partition partition, List<Object> params) {
        String avg = partition.hasColumn("average_contract_value")
                ? "CAST(average_contract_value AS DOUBLE)"
                : "CAST(total_contract_value AS DOUBLE) / NULLIF(CAST(contract_count AS DOUBLE), 0)";
        StringBuilder sql = new StringBuilder()
                .append("SELECT CAST(entity AS VARCHAR) AS label, ")
                .append("CAST(total_contract_value AS DOUBLE) AS total_value, ")
                .append("CAST(contract_count AS BIGINT) AS count, ")
                .append(avg).append(" AS avg_value ")
                .append("FROM ").append(partition.source())
                .append(" WHERE entity IS NOT NULL");
        appendMarkerExclusion(sql, "CAST(entity AS VARCHAR)", false, params);
        return sql.toString();
    }

    private PaginatedAggregatesResponse pageGroups(String grouped, List<Object> params, AggregateDimension dimension,
                                                   AggregateSortField sortField, SortDirection direction,
                                                   int page, int pageSize, String source) {
        long offset = (long) (page - 1) * pageSize;
        String sql = "WITH grouped AS MATERIALIZED (" + grouped + ") "
                + "SELECT t.total_count, p.* "
                + "FROM (SELECT COUNT(*) AS total_count FROM grouped) t "
                + "LEFT JOIN (SELECT *, TRUE AS page_hit FROM grouped ORDER BY " + sortField.orderBy(direction, null)
                + " LIMIT " + pageSize + " OFFSET " + offset + ") p ON TRUE "
                + "ORDER BY " + sortField.orderBy(direction, "p");

        long[] totalCount = {0};
        List<AggregateRow> rows = new ArrayList<>();
        engine.jdbc().query(sql, (RowCallbackHandler) rs -> {
            totalCount[0] = rs.getLong("total_count");
            if (rs.getObject("page_hit") != null) {
                rows.add(GROUP_ROW.mapRow(rs, rows.size()));
            }
        }, params.toArray());

        return PaginatedAggregatesResponse.builder()
                .success(true)
                .dimension(dimension)
                .data(rows)
                .pagination(Pagination.of(page, pageSize, totalCount[0]))
                .source(source)
                .build();
    }

    private void appendMarkerExclusion(StringBuilder sql, String column, boolean includeSupplementary,
                                       List<Object> params) {
        if (!includeSupplementary && hasMarker()) {
            sql.append(" AND NOT contains(lower(").append(column).append("), ?)");
            params.add(supplementaryMarker.toLowerCase(Locale.ROOT));
        }
    }

    private boolean hasMarker() {
        return supplementaryMarker != null && !supplementaryMarker.isBlank();
    }

    private AggregateSummary summary(JdbcTemplate jdbc) {
        return jdbc.queryForObject("SELECT COUNT(*) AS count, COALESCE(SUM(amount), 0) AS total_value, "
                        + "COALESCE(AVG(amount), 0) AS avg_value FROM " + SCOPE_TABLE,
                (rs, rowNum) -> new AggregateSummary(rs.getLong("count"), rs.getDouble("total_value"),
                        rs.getDouble("avg_value")));
    }

    private List<YearlyTotal> byYear(JdbcTemplate jdbc) {
        return jdbc.query("SELECT CAST(year(award_date) AS INTEGER) AS year, SUM(amount) AS total_value, "
                        + "COUNT(*) AS count FROM " + SCOPE_TABLE + " WHERE award_date IS NOT NULL "
                        + "GROUP BY 1 ORDER BY 1",
                (rs, rowNum) -> new YearlyTotal(rs.getInt("year"), nullableDouble(rs.getObject("total_value")),
                        rs.getLong("count")));
    }

    private List<MonthlyTotal> byMonth(JdbcTemplate jdbc) {
        return jdbc.query("SELECT strftime(award_date, '%Y-%m') AS month, SUM(amount) AS total_value, "
                        + "COUNT(*) AS count FROM " + SCOPE_TABLE + " WHERE award_date IS NOT NULL "
                        + "GROUP BY 1 ORDER BY 1",
                (rs, rowNum) -> new MonthlyTotal(rs.getString("month"), nullableDouble(rs.getObject("total_value")),
                        rs.getLong("count")));
    }

    private List<AggregateRow> topN(JdbcTemplate jdbc, AggregateDimension dimension, int limit) {
        String column = dimension.column();
        return jdbc.query("SELECT " + column + " AS label, SUM(amount) AS total_value, COUNT(*) AS count "
                        + "FROM " + SCOPE_TABLE + " WHERE " + column + " IS NOT NULL "
                        + "GROUP BY " + column + " ORDER BY total_value DESC NULLS LAST, label ASC LIMIT " + limit,
                (rs, rowNum) -> AggregateRow.builder()
                        .label(rs.getString("label"))
                        .totalValue(nullableDouble(rs.getObject("total_value")))
                        .count(rs.getLong("count"))
                        .build());
    }

    private <T> T view(String name, T fallback, Supplier<T> query) {
        try {
            return query.get();
        } catch (Exception e) {
            log.warn("Aggregate view {} failed, returning empty: {}", name, e.getMessage());
            return fallback;
        }
    }

    private static Double nullableDouble(Object value) {
        return value == null ? null : ((Number) value).doubleValue();
    }
}
