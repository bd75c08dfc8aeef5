package io.rift.server.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Probes the database with a short validity check.
 */
@Service
public class HealthService {
    private static final Logger log = LoggerFactory.getLogger(HealthService.class);
    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final DataSource dataSource;

    public HealthService(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public boolean databaseReachable() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException | RuntimeException e) {
            log.error("Database health check failed", e);
            return false;
        }
    }
}
