package com.govcontracts.domain.service;

import com.govcontracts.domain.exception.ContractsException;
import com.govcontracts.domain.exception.ErrorKind;
import com.govcontracts.domain.exception.SearchException;
import com.govcontracts.domain.exception.ValidationException;
import com.govcontracts.domain.filter.FilterNode;
import com.govcontracts.domain.filter.SortSpec;
import com.govcontracts.domain.filter.SqlFragment;
import com.govcontracts.domain.filter.SqlPredicateRenderer;
import com.govcontracts.domain.model.ContractRecord;
import com.govcontracts.domain.model.ContractSearchResponse;
import com.govcontracts.domain.model.FilterOptions;
import com.govcontracts.domain.model.Pagination;
import com.govcontracts.infrastructure.dataset.ContractRecordMapper;
import com.govcontracts.infrastructure.dataset.DatasetCatalog;
import com.govcontracts.infrastructure.dataset.DuckDbEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs filtered record queries over the union of the selected partitions.
 *
 * Search Flow:
 * 1. Build the canonical UNION ALL of the selected partitions
 * 2. Apply the rendered predicate (values as bind parameters)
 * 3. Materialize the filtered rows once
 * 4. Read the total count and the sorted page from that one result
 *
 * The count is left-joined to the page, so a page past the end still
 * reports the true total. Export uses the unsorted, count-free batch read,
 * which relies on DuckDB preserving insertion order.
 *
 * Failure Handling:
 * - Validation errors are thrown to the caller
 * - Engine errors become {@code success=false} results from {@link #search}
 * - The batch and count reads throw {@link SearchException} so callers can retry
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryExecutor {

    public static final int MAX_PAGE_SIZE = 1000;

    private final DuckDbEngine engine;
    private final DatasetCatalog catalog;

    public ContractSearchResponse search(FilterNode predicate, SortSpec sort, int page, int pageSize,
                                         boolean includeSupplementary) {
        validatePage(page, pageSize);
        long startTime = System.currentTimeMillis();

        try {
            Optional<String> union = catalog.unionSql(includeSupplementary);
            if (union.isEmpty()) {
                log.info("Search skipped: no fact partitions available");
                return ContractSearchResponse.builder()
                        .success(true)
                        .data(List.of())
                        .pagination(Pagination.empty(page, pageSize))
                        .build();
            }

            SqlFragment where = SqlPredicateRenderer.render(predicate);
            long offset = (long) (page - 1) * pageSize;
            String sql = "WITH filtered AS MATERIALIZED (SELECT * FROM (" + union.get() + ") c WHERE " + where.getSql() + ") "
                    + "SELECT t.total_count, p.* "
                    + "FROM (SELECT COUNT(*) AS total_count FROM filtered) t "
                    + "LEFT JOIN (SELECT *, TRUE AS page_hit FROM filtered ORDER BY " + sort.orderBy(null)
                    + " LIMIT " + pageSize + " OFFSET " + offset + ") p ON TRUE "
                    + "ORDER BY " + sort.orderBy("p");

            long[] totalCount = {0};
            List<ContractRecord> rows = new ArrayList<>();
            engine.jdbc().query(sql, (RowCallbackHandler) rs -> {
                totalCount[0] = rs.getLong("total_count");
                if (rs.getObject("page_hit") != null) {
                    rows.add(ContractRecordMapper.INSTANCE.mapRow(rs, rows.size()));
                }
            }, where.paramArray());

            long queryTime = System.currentTimeMillis() - startTime;
            log.info("Search executed: {} of {} rows (page {}, size {}, sort {} {}), {} ms",
                    rows.size(), totalCount[0], page, pageSize, sort.getField(), sort.getDirection(), queryTime);

            return ContractSearchResponse.builder()
                    .success(true)
                    .data(rows)
                    .pagination(Pagination.of(page, pageSize, totalCount[0]))
                    .build();

        } catch (Exception e) {
            log.error("Error executing search: {}", e.getMessage(), e);
            return ContractSearchResponse.failure(page, pageSize, e.getMessage());
        }
    }

    /**
     * Rows {@code [offset, offset + limit)} of the filtered union ordered by
     * reference id, without a count. Consecutive calls page through the data
     * with stable batch boundaries.
     */
    public List<ContractRecord> fetchBatch(FilterNode predicate, boolean includeSupplementary, long offset, int limit) {
        try {
            Optional<String> union = catalog.unionSql(includeSupplementary);
            if (union.isEmpty()) {
                return List.of();
            }
            SqlFragment where = SqlPredicateRenderer.render(predicate);
            String sql = "SELECT * FROM (" + union.get() + ") c WHERE " + where.getSql()
                    + " ORDER BY reference_id, partition_id, award_date"
                    + " LIMIT " + limit + " OFFSET " + offset;
            return engine.jdbc().query(sql, ContractRecordMapper.INSTANCE, where.paramArray());
        } catch (ContractsException e) {
            throw e;
        } catch (Exception e) {
            throw new SearchException("Batch read failed at offset " + offset + ": " + e.getMessage(), e);
        }
    }

    public long count(FilterNode predicate, boolean includeSupplementary) {
        try {
            Optional<String> union = catalog.unionSql(includeSupplementary);
            if (union.isEmpty()) {
                return 0;
            }
            SqlFragment where = SqlPredicateRenderer.render(predicate);
            Long count = engine.jdbc().queryForObject(
                    "SELECT COUNT(*) FROM (" + union.get() + ") c WHERE " + where.getSql(),
                    Long.class, where.paramArray());
            return count == null ? 0 : count;
        } catch (ContractsException e) {
            throw e;
        } catch (Exception e) {
            throw new SearchException("Count failed: " + e.getMessage(), e);
        }
    }

    /**
     * Distinct values for each filter dropdown. Always reads the
     * supplementary partition too, so its values are selectable.
     */
    public FilterOptions filterOptions() {
        Optional<String> union = catalog.unionSql(true);
        if (union.isEmpty()) {
            return FilterOptions.empty();
        }
        String base = union.get();
        try {
            return FilterOptions.builder()
                    .contractors(distinct(base, "awardee_name"))
                    .areas(distinct(base, "area_of_delivery"))
                    .organizations(distinct(base, "organization_name"))
                    .businessCategories(distinct(base, "business_category"))
                    .years(engine.jdbc().queryForList(
                            "SELECT DISTINCT CAST(year(award_date) AS INTEGER) AS y FROM (" + base + ") c "
                                    + "WHERE award_date IS NOT NULL ORDER BY 1",
                            Integer.class))
                    .build();
        } catch (Exception e) {
            throw new ContractsException(ErrorKind.FILTER_OPTIONS, "Filter options failed: " + e.getMessage(), e);
        }
    }

    private List<String> distinct(String base, String column) {
        return engine.jdbc().queryForList(
                "SELECT DISTINCT " + column + " FROM (" + base + ") c WHERE " + column + " IS NOT NULL "
                        + "AND trim(" + column + ") <> '' ORDER BY 1",
                String.class);
    }

    public static void validatePage(int page, int pageSize) {
        if (page < 1) {
            throw new ValidationException(ErrorKind.VALIDATION, "page must be >= 1, got " + page);
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new ValidationException(ErrorKind.INVALID_PAGE_SIZE,
                    "page_size must be between 1 and " + MAX_PAGE_SIZE + ", got " + pageSize);
        }
    }
}
