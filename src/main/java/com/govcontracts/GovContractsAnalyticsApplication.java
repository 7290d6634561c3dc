package com.govcontracts;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Government Contracts Analytics Backend
 *
 * Search, aggregation, value distribution and CSV export over a columnar
 * (Parquet) contracts dataset.
 *
 * Architecture:
 * - REST APIs for contract queries and exports
 * - DuckDB scans over catalogued Parquet partitions
 * - Redis caching for query responses and task results
 * - Background tasks with retry, cancellation and progress events
 */
@SpringBootApplication
@EnableScheduling
public class GovContractsAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(GovContractsAnalyticsApplication.class, args);
    }
}
