package com.kmg.exporter.service;

import com.kmg.exporter.TestDatabases;
import com.kmg.exporter.model.AccumulationPolicy;
import com.kmg.exporter.model.GateDecision;
import com.kmg.exporter.model.GateOutcome;
import com.kmg.exporter.model.JobDefinition;
import com.kmg.exporter.model.ThresholdAlignment;
import com.kmg.exporter.repo.GatingParameterRepository;
import com.kmg.exporter.source.SourceConnectionFactory;
import com.kmg.exporter.source.SourceQueryRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.Statement;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GateEvaluatorTest {

    @TempDir
    Path tempDir;

    private JdbcTemplate store;
    private DataSource source;

    @BeforeEach
    void setUp() throws Exception {
        store = TestDatabases.store(tempDir);
        source = TestDatabases.source(tempDir);
        try (Connection connection = source.getConnection(); Statement statement = connection.createStatement()) {
            statement.execute("CREATE TABLE unit_status (instancia TEXT, valor TEXT)");
            statement.execute("INSERT INTO unit_status VALUES ('SP', '2024-02-29'), ('RJ', '2024-02-15')");
        }
        store.update("INSERT INTO gating_parameters(id, name, sql_script) VALUES (1, 'closing', ?)",
                "SELECT instancia, valor FROM unit_status ORDER BY instancia");
        store.update("INSERT INTO gating_parameters(id, name, sql_script) VALUES (2, 'bad', 'DELETE FROM unit_status')");
        store.update("INSERT INTO gating_parameters(id, name, sql_script) VALUES (3, 'narrow', 'SELECT instancia FROM unit_status')");
    }

    @Test
    void shouldReportOpenUnitsBehindMonthEndThreshold() {
        GateDecision decision = evaluator(ThresholdAlignment.END_OF_MONTH).evaluate(job(1L), LocalDate.of(2024, 3, 18));

        assertEquals(GateOutcome.PENDING, decision.outcome());
        assertEquals(LocalDate.of(2024, 2, 29), decision.threshold());
        assertEquals(List.of("RJ"), decision.openUnits());
    }

    @Test
    void shouldBeReadyOnceAllUnitsReachedThreshold() throws Exception {
        try (Connection connection = source.getConnection(); Statement statement = connection.createStatement()) {
            statement.execute("UPDATE unit_status SET valor = '2024-03-01' WHERE instancia = 'RJ'");
        }

        GateDecision decision = evaluator(ThresholdAlignment.END_OF_MONTH).evaluate(job(1L), LocalDate.of(2024, 3, 18));

        assertEquals(GateOutcome.READY, decision.outcome());
        assertTrue(decision.openUnits().isEmpty());
    }

    @Test
    void shouldUseOffsetDayAsThresholdWithDayAlignment() {
        GateEvaluator evaluator = evaluator(ThresholdAlignment.DAY);

        assertEquals(LocalDate.of(2024, 3, 17), evaluator.threshold(LocalDate.of(2024, 3, 18), 1));
        GateDecision decision = evaluator.evaluate(job(1L), LocalDate.of(2024, 2, 20));
        assertEquals(GateOutcome.PENDING, decision.outcome());
        assertEquals(List.of("RJ"), decision.openUnits());
    }

    @Test
    void shouldPassUngatedJobs() {
        GateDecision decision = evaluator(ThresholdAlignment.END_OF_MONTH).evaluate(job(null), LocalDate.of(2024, 3, 18));

        assertEquals(GateOutcome.READY, decision.outcome());
        assertNull(decision.threshold());
    }

    @Test
    void shouldReportErrorForMissingParameter() {
        GateDecision decision = evaluator(ThresholdAlignment.END_OF_MONTH).evaluate(job(99L), LocalDate.of(2024, 3, 18));

        assertEquals(GateOutcome.ERROR, decision.outcome());
        assertTrue(decision.error().contains("99"));
    }

    @Test
    void shouldReportErrorForMutatingGateQuery() {
        GateDecision decision = evaluator(ThresholdAlignment.END_OF_MONTH).evaluate(job(2L), LocalDate.of(2024, 3, 18));

        assertEquals(GateOutcome.ERROR, decision.outcome());
    }

    @Test
    void shouldReportErrorWhenGateQueryLacksDateColumn() {
        GateDecision decision = evaluator(ThresholdAlignment.END_OF_MONTH).evaluate(job(3L), LocalDate.of(2024, 3, 18));

        assertEquals(GateOutcome.ERROR, decision.outcome());
    }

    @Test
    void shouldReportErrorForUnparsableUnitDate() throws Exception {
        try (Connection connection = source.getConnection(); Statement statement = connection.createStatement()) {
            statement.execute("INSERT INTO unit_status VALUES ('MG', 'pending')");
        }

        GateDecision decision = evaluator(ThresholdAlignment.END_OF_MONTH).evaluate(job(1L), LocalDate.of(2024, 3, 18));

        assertEquals(GateOutcome.ERROR, decision.outcome());
        assertTrue(decision.error().contains("MG"));
    }

    private GateEvaluator evaluator(ThresholdAlignment alignment) {
        SourceConnectionFactory connectionFactory = new SourceConnectionFactory(
                source, List.of(2391), Duration.ofMillis(1), duration -> { });
        return new GateEvaluator(new GatingParameterRepository(store), connectionFactory,
                new SourceQueryRunner(100), alignment);
    }

    private static JobDefinition job(Long parameterId) {
        return new JobDefinition(5, "Closing", true, "SELECT 1 FROM DUAL", "/tmp", "closing",
                AccumulationPolicy.MONTHLY, 0, parameterId, null, "SALE_DATE", null, null);
    }
}
