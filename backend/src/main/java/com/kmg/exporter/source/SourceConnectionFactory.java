package com.kmg.exporter.source;

import com.kmg.exporter.config.ExporterProperties;
import com.kmg.exporter.service.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Collection;
import java.util.Set;

/**
 * Opens unpooled connections to the analytical database. Each execution owns the connection it
 * opens. When the database refuses a session because its connection limit is reached, the open is
 * retried after a fixed delay until it succeeds; any other error is thrown immediately.
 */
@Component
public class SourceConnectionFactory {
    private static final Logger log = LoggerFactory.getLogger(SourceConnectionFactory.class);

    private final DataSource dataSource;
    private final Set<Integer> connectionLimitCodes;
    private final Duration retryDelay;
    private final Sleeper sleeper;

    @Autowired
    public SourceConnectionFactory(ExporterProperties properties) {
        this(
                createDataSource(properties.getSource()),
                properties.getSource().getConnectionLimitCodes(),
                properties.getSource().getConnectionRetryDelay(),
                Sleeper.THREAD
        );
    }

    public SourceConnectionFactory(DataSource dataSource, Collection<Integer> connectionLimitCodes,
                                   Duration retryDelay, Sleeper sleeper) {
        this.dataSource = dataSource;
        this.connectionLimitCodes = Set.copyOf(connectionLimitCodes);
        this.retryDelay = retryDelay;
        this.sleeper = sleeper;
    }

    private static DataSource createDataSource(ExporterProperties.Source source) {
        return new DriverManagerDataSource(source.getUrl(), source.getUsername(), source.getPassword());
    }

    public Connection open() throws SQLException {
        int attempt = 0;
        while (true) {
            try {
                return dataSource.getConnection();
            } catch (SQLException e) {
                if (!isConnectionLimit(e)) {
                    throw e;
                }
                attempt++;
                log.warn("Source connection limit reached (attempt {}), retrying in {}s: {}",
                        attempt, retryDelay.toSeconds(), e.getMessage());
                try {
                    sleeper.sleep(retryDelay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new SQLException("Interrupted while waiting for a source connection", e);
                }
            }
        }
    }

    /**
     * Runs the validation query once; used at startup to fail fast on a misconfigured source.
     */
    public void verify(String validationQuery) throws SQLException {
        try (Connection connection = open();
             Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery(validationQuery)) {
            if (!rs.next()) {
                throw new SQLException("Validation query returned no rows: " + validationQuery);
            }
        }
    }

    boolean isConnectionLimit(SQLException error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof SQLException sql && matchesLimit(sql)) {
                return true;
            }
        }
        SQLException next = error.getNextException();
        return next != null && next != error && isConnectionLimit(next);
    }

    private boolean matchesLimit(SQLException error) {
        if (connectionLimitCodes.contains(error.getErrorCode())) {
            return true;
        }
        String message = error.getMessage();
        if (message == null) {
            return false;
        }
        for (Integer code : connectionLimitCodes) {
            if (message.contains(String.format("ORA-%05d", code))) {
                return true;
            }
        }
        return false;
    }
}
