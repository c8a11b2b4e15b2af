package com.kmg.exporter.service;

import com.kmg.exporter.TestDatabases;
import com.kmg.exporter.export.ExportWriter;
import com.kmg.exporter.repo.EventualRequestRepository;
import com.kmg.exporter.repo.ExecutionEventRepository;
import com.kmg.exporter.source.SourceConnectionFactory;
import com.kmg.exporter.source.SourceQueryRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventualJobServiceTest {

    @TempDir
    Path tempDir;

    private JdbcTemplate store;
    private EventualRequestRepository requestRepository;
    private EventualJobService service;
    private Path eventualDir;

    @BeforeEach
    void setUp() throws Exception {
        store = TestDatabases.store(tempDir);
        DataSource source = TestDatabases.source(tempDir);
        try (Connection connection = source.getConnection(); Statement statement = connection.createStatement()) {
            statement.execute("CREATE TABLE customers (id INTEGER, name TEXT)");
            statement.execute("INSERT INTO customers VALUES (1, 'Ana'), (2, 'Bruno')");
        }
        eventualDir = tempDir.resolve("eventual");
        requestRepository = new EventualRequestRepository(store);
        SourceConnectionFactory connectionFactory = new SourceConnectionFactory(
                source, List.of(2391), Duration.ofMillis(1), duration -> { });
        service = new EventualJobService(
                requestRepository,
                new ExtractionService(connectionFactory, new SourceQueryRunner(100)),
                new ExportWriter(';'),
                new EventService(new ExecutionEventRepository(store)),
                eventualDir);
    }

    @Test
    void shouldExportRequestAndRemoveIt() throws Exception {
        requestRepository.insert("customers", "SELECT id, name FROM customers ORDER BY id");

        assertEquals(1, service.drain());

        assertEquals(List.of("id;name", "1;Ana", "2;Bruno"),
                Files.readAllLines(eventualDir.resolve("customers.csv"), StandardCharsets.UTF_8));
        assertTrue(requestRepository.findAll().isEmpty());
    }

    @Test
    void shouldRemoveFailedRequestAfterSingleAttempt() {
        requestRepository.insert("broken", "SELECT * FROM missing_table");
        requestRepository.insert("rogue", "DROP TABLE customers");

        assertEquals(2, service.drain());

        assertTrue(requestRepository.findAll().isEmpty());
        assertFalse(Files.exists(eventualDir.resolve("broken.csv")));
        assertEquals(2, store.queryForObject(
                "SELECT COUNT(*) FROM execution_events WHERE level = 'ERROR'", Integer.class));
        assertEquals(0, service.drain());
    }

    @Test
    void shouldContinueWithNextRequestAfterFailure() throws Exception {
        requestRepository.insert("broken", "SELECT * FROM missing_table");
        requestRepository.insert("customers", "SELECT name FROM customers ORDER BY id");

        service.drain();

        assertEquals(List.of("name", "Ana", "Bruno"),
                Files.readAllLines(eventualDir.resolve("customers.csv"), StandardCharsets.UTF_8));
    }

    @Test
    void shouldRejectExportNamesEscapingTheEventualDirectory() {
        assertThrows(IllegalArgumentException.class, () -> service.targetFor("../etc/passwd"));
        assertEquals(eventualDir.resolve("daily.csv"), service.targetFor("daily"));
    }
}
