package com.kmg.exporter.service;

import com.kmg.exporter.export.ExportSink;
import com.kmg.exporter.model.ExportOutcome;
import com.kmg.exporter.source.SourceConnectionFactory;
import com.kmg.exporter.source.SourceQueryRunner;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Streams a query into an export sink over a connection owned by this call.
 */
@Service
public class ExtractionService {
    private final SourceConnectionFactory connectionFactory;
    private final SourceQueryRunner queryRunner;

    public ExtractionService(SourceConnectionFactory connectionFactory, SourceQueryRunner queryRunner) {
        this.connectionFactory = connectionFactory;
        this.queryRunner = queryRunner;
    }

    public ExportOutcome run(String sql, List<Object> binds, ExportSink sink) throws SQLException, IOException {
        try (sink; Connection connection = connectionFactory.open()) {
            long rows = queryRunner.stream(connection, sql, binds, sink);
            List<Path> files = sink.commit();
            return new ExportOutcome(rows, files);
        }
    }
}
