package com.govcontracts.infrastructure.dataset;

import org.springframework.jdbc.datasource.AbstractDataSource;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Hands out duplicates of the engine's root connection. Closing one only
 * releases the duplicate.
 */
class DuckDbDataSource extends AbstractDataSource {

    private final DuckDbEngine engine;

    DuckDbDataSource(DuckDbEngine engine) {
        this.engine = engine;
    }

    @Override
    public Connection getConnection() throws SQLException {
        return engine.openConnection();
    }

    @Override
    public Connection getConnection(String username, String password) throws SQLException {
        return getConnection();
    }
}
