package com.koni.greenhouse.infrastructure.persistence;

import com.koni.greenhouse.application.port.StorageHealthProbe;
import com.koni.greenhouse.domain.exception.DatabaseUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;

/**
 * Verifies database connectivity by executing "SELECT 1".
 */
@Slf4j
@Component
public class JdbcStorageHealthProbe implements StorageHealthProbe {

    private final DataSource dataSource;
    private final int queryTimeoutSeconds;

    public JdbcStorageHealthProbe(DataSource dataSource,
                                  @Value("${greenhouse.health.db-timeout:2s}") Duration timeout) {
        this.dataSource = dataSource;
        this.queryTimeoutSeconds = (int) Math.max(1, timeout.toSeconds());
    }

    @Override
    public void ping() {
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            statement.setQueryTimeout(queryTimeoutSeconds);
            try (ResultSet resultSet = statement.executeQuery("SELECT 1")) {
                if (!resultSet.next() || resultSet.getInt(1) != 1) {
                    throw new DatabaseUnavailableException("SELECT 1 did not return expected result");
                }
            }
        } catch (SQLException e) {
            log.debug("Database ping failed: {}", e.getMessage());
            throw new DatabaseUnavailableException(e.getMessage(), e);
        }
    }
}
