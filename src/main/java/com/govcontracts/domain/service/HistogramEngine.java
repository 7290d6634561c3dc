package com.govcontracts.domain.service;

import com.govcontracts.domain.exception.ValidationException;
import com.govcontracts.domain.filter.FilterNode;
import com.govcontracts.domain.filter.SqlFragment;
import com.govcontracts.domain.filter.SqlPredicateRenderer;
import com.govcontracts.domain.model.HistogramBin;
import com.govcontracts.domain.model.ValueDistributionRequest;
import com.govcontracts.domain.model.ValueDistributionResponse;
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
 * Equal-width histogram of positive contract amounts.
 *
 * One statement materializes the filtered amounts, derives min/max, and
 * groups every amount into {@code clamp(floor((v - min) / width) + 1, 1, numBins)}.
 * The maximum falls in the last bin; when min equals max everything is bin 1.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HistogramEngine {

    private final DuckDbEngine engine;
    private final DatasetCatalog catalog;

    public static void validateBins(int numBins) {
        if (numBins < 1 || numBins > ValueDistributionRequest.MAX_BINS) {
            throw new ValidationException("num_bins must be between 1 and " + ValueDistributionRequest.MAX_BINS
                    + ", got " + numBins);
        }
    }

    public ValueDistributionResponse distribution(FilterNode predicate, boolean includeSupplementary, int numBins) {
        validateBins(numBins);
        long startTime = System.currentTimeMillis();

        try {
            Optional<String> union = catalog.unionSql(includeSupplementary);
            if (union.isEmpty()) {
                return ValueDistributionResponse.empty(numBins);
            }

            SqlFragment where = SqlPredicateRenderer.render(predicate);
            String sql = "WITH amounts AS MATERIALIZED ("
                    + "SELECT CAST(contract_amount AS DOUBLE) AS amount FROM (" + union.get() + ") c "
                    + "WHERE " + where.getSql() + " AND contract_amount IS NOT NULL AND CAST(contract_amount AS DOUBLE) > 0), "
                    + "stats AS (SELECT MIN(amount) AS min_value, MAX(amount) AS max_value, COUNT(*) AS total FROM amounts), "
                    + "binned AS (SELECT CASE WHEN s.max_value = s.min_value THEN 1 "
                    + "ELSE LEAST(GREATEST(CAST(FLOOR((a.amount - s.min_value) / ((s.max_value - s.min_value) / ?)) AS BIGINT) + 1, 1), ?) "
                    + "END AS bin_number, a.amount FROM amounts a CROSS JOIN stats s), "
                    + "bins AS (SELECT bin_number, COUNT(*) AS count, SUM(amount) AS total_value, AVG(amount) AS avg_value "
                    + "FROM binned GROUP BY bin_number) "
                    + "SELECT s.min_value, s.max_value, s.total, b.bin_number, b.count, b.total_value, b.avg_value "
                    + "FROM stats s LEFT JOIN bins b ON TRUE ORDER BY b.bin_number";

            List<Object> params = new ArrayList<>(where.getParams());
            params.add((double) numBins);
            params.add(numBins);

            double[] range = {0, 0};
            long[] total = {0};
            List<HistogramBin> bins = new ArrayList<>();
            engine.jdbc().query(sql, (RowCallbackHandler) rs -> {
                total[0] = rs.getLong("total");
                if (rs.getObject("min_value") == null) {
                    return;
                }
                range[0] = rs.getDouble("min_value");
                range[1] = rs.getDouble("max_value");
                if (rs.getObject("bin_number") == null) {
                    return;
                }
                bins.add(HistogramBin.builder()
                        .binNumber(rs.getInt("bin_number"))
                        .count(rs.getLong("count"))
                        .totalValue(rs.getDouble("total_value"))
                        .avgValue(rs.getDouble("avg_value"))
                        .build());
            }, params.toArray());

            if (total[0] == 0) {
                return ValueDistributionResponse.empty(numBins);
            }

            double min = range[0];
            double max = range[1];
            double width = (max - min) / numBins;
            for (HistogramBin bin : bins) {
                bin.setBinStart(min + (bin.getBinNumber() - 1) * width);
                bin.setBinEnd(bin.getBinNumber() == numBins ? max : min + bin.getBinNumber() * width);
            }

            log.info("Value distribution computed: {} contracts in {} non-empty bins of {}, {} ms",
                    total[0], bins.size(), numBins, System.currentTimeMillis() - startTime);

            return ValueDistributionResponse.builder()
                    .success(true)
                    .minValue(min)
                    .maxValue(max)
                    .binWidth(width)
                    .numBins(numBins)
                    .totalContracts(total[0])
                    .bins(bins)
                    .build();

        } catch (Exception e) {
            log.error("Error computing value distribution: {}", e.getMessage(), e);
            return ValueDistributionResponse.failure(numBins, e.getMessage());
        }
    }
}
