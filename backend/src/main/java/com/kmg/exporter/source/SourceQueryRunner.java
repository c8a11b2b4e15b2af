package com.kmg.exporter.source;

import com.kmg.exporter.config.ExporterProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Executes a query and hands its rows to a {@link RowBatchHandler} in batches of at most
 * {@code fetchSize} rows; the full result is never held in memory.
 */
@Component
public class SourceQueryRunner {
    private final int fetchSize;

    @Autowired
    public SourceQueryRunner(ExporterProperties properties) {
        this(properties.getSource().getFetchSize());
    }

    public SourceQueryRunner(int fetchSize) {
        if (fetchSize < 1) {
            throw new IllegalArgumentException("fetchSize must be positive");
        }
        this.fetchSize = fetchSize;
    }

    /**
     * @param binds values for the statement placeholders in order; only as many as the statement
     *              declares are bound
     * @return number of rows delivered
     */
    public long stream(Connection connection, String sql, List<Object> binds, RowBatchHandler handler)
            throws IOException {
        try (PreparedStatement statement = connection.prepareStatement(
                sql, ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY)) {
            statement.setFetchSize(fetchSize);
            bind(statement, binds);

            try (ResultSet rs = statement.executeQuery()) {
                ResultSetMetaData metaData = rs.getMetaData();
                int columnCount = metaData.getColumnCount();
                List<String> names = new ArrayList<>(columnCount);
                for (int i = 1; i <= columnCount; i++) {
                    names.add(metaData.getColumnLabel(i));
                }
                handler.columns(names);

                long total = 0;
                List<Object[]> batch = new ArrayList<>();
                while (rs.next()) {
                    Object[] row = new Object[columnCount];
                    for (int i = 0; i < columnCount; i++) {
                        row[i] = rs.getObject(i + 1);
                    }
                    batch.add(row);
                    if (batch.size() >= fetchSize) {
                        handler.batch(batch);
                        total += batch.size();
                        batch = new ArrayList<>();
                    }
                }
                if (!batch.isEmpty()) {
                    handler.batch(batch);
                    total += batch.size();
                }
                return total;
            }
        } catch (SQLException e) {
            throw new ExtractionFailedException("Query failed: " + e.getMessage(), e);
        }
    }

    private void bind(PreparedStatement statement, List<Object> binds) throws SQLException {
        if (binds == null || binds.isEmpty()) {
            return;
        }
        int declared = statement.getParameterMetaData().getParameterCount();
        if (declared > binds.size()) {
            throw new ExtractionFailedException(
                    "Query declares " + declared + " parameters but only " + binds.size() + " values are available");
        }
        for (int i = 0; i < declared; i++) {
            statement.setObject(i + 1, binds.get(i));
        }
    }

    public static class ExtractionFailedException extends RuntimeException {
        public ExtractionFailedException(String message) {
            super(message);
        }

        public ExtractionFailedException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
