package com.govcontracts.infrastructure.dataset;

import com.govcontracts.domain.exception.ContractsException;
import com.govcontracts.domain.exception.ErrorKind;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.duckdb.DuckDBConnection;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Process-wide in-memory DuckDB database used to scan the Parquet partitions.
 *
 * Lifecycle:
 * 1. The root connection is opened on first use
 * 2. Session settings (threads, memory limit, object cache) are applied once
 * 3. Every scan runs on its own duplicate of the root connection
 * 4. The root connection is closed on shutdown
 *
 * Duplicated connections share the database and its object cache but not
 * temporary tables, so work that needs a temp table goes through
 * {@link #withSession(Function)}.
 *
 * The DataSource behind {@link #jdbc()} is not a Spring bean:
 * the application DataSource stays the relational one used for task records.
 */
@Slf4j
@Component
public class DuckDbEngine {

    private static final Pattern MEMORY_LIMIT = Pattern.compile("\\d+(\\.\\d+)?\\s*(B|KB|MB|GB|TB|KiB|MiB|GiB|TiB)",
            Pattern.CASE_INSENSITIVE);

    private final int threads;
    private final String memoryLimit;
    private final boolean objectCache;
    private final JdbcTemplate jdbcTemplate;

    private DuckDBConnection root;

    public DuckDbEngine(@Value("${app.dataset.threads:4}") int threads,
                        @Value("${app.dataset.memory-limit:4GB}") String memoryLimit,
                        @Value("${app.dataset.object-cache:true}") boolean objectCache) {
        if (threads < 1) {
            throw new IllegalArgumentException("app.dataset.threads must be positive: " + threads);
        }
        if (!MEMORY_LIMIT.matcher(memoryLimit.trim()).matches()) {
            throw new IllegalArgumentException("app.dataset.memory-limit is not a size: " + memoryLimit);
        }
        this.threads = threads;
        this.memoryLimit = memoryLimit.trim();
        this.objectCache = objectCache;
        this.jdbcTemplate = new JdbcTemplate(new DuckDbDataSource(this));
    }

    /**
     * Template whose every statement runs on a fresh duplicated connection.
     */
    public JdbcTemplate jdbc() {
        return jdbcTemplate;
    }

    /**
     * Run several statements on one connection, so temp tables created by
     * the first are visible to the rest. The connection is closed afterwards.
     */
    public <T> T withSession(Function<JdbcTemplate, T> work) {
        try (Connection connection = openConnection()) {
            SingleConnectionDataSource session = new SingleConnectionDataSource(connection, true);
            return work.apply(new JdbcTemplate(session));
        } catch (SQLException e) {
            throw new ContractsException(ErrorKind.DATASET_UNAVAILABLE, "DuckDB session failed: " + e.getMessage(), e);
        }
    }

    Connection openConnection() throws SQLException {
        return rootConnection().duplicate();
    }

    private synchronized DuckDBConnection rootConnection() throws SQLException {
        if (root == null) {
            DuckDBConnection connection = (DuckDBConnection) DriverManager.getConnection("jdbc:duckdb:");
            try (Statement statement = connection.createStatement()) {
                statement.execute("SET threads TO " + threads);
                statement.execute("SET memory_limit = '" + memoryLimit + "'");
                statement.execute("SET enable_object_cache TO " + objectCache);
            } catch (SQLException e) {
                connection.close();
                throw e;
            }
            root = connection;
            log.info("DuckDB engine initialized (threads={}, memory_limit={}, object_cache={})",
                    threads, memoryLimit, objectCache);
        }
        return root;
    }

    @PreDestroy
    public synchronized void close() {
        if (root != null) {
            try {
                root.close();
                log.info("DuckDB engine closed");
            } catch (SQLException e) {
                log.warn("Error closing DuckDB engine: {}", e.getMessage());
            }
            root = null;
        }
    }
}
