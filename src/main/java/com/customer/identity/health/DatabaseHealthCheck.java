package com.customer.identity.health;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Borrows a connection and validates it against the database.
 */
public class DatabaseHealthCheck implements HealthCheck {

    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final DataSource dataSource;

    public DatabaseHealthCheck(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public String getName() {
        return "database";
    }

    @Override
    public HealthStatus check() {
        long startMs = System.currentTimeMillis();
        try (Connection connection = dataSource.getConnection()) {
            boolean valid = connection.isValid(VALIDATION_TIMEOUT_SECONDS);
            long latencyMs = System.currentTimeMillis() - startMs;
            HealthStatus status = valid ? HealthStatus.up() : HealthStatus.down("Connection is not valid");
            return status.withDetail("latencyMs", latencyMs);
        } catch (SQLException e) {
            return HealthStatus.down("Database connection failed: " + e.getMessage())
                    .withDetail("error", e.getClass().getSimpleName())
                    .withDetail("sqlState", String.valueOf(e.getSQLState()));
        }
    }
}
