package com.kmg.exporter.service;

import com.kmg.exporter.config.ExporterProperties;
import com.kmg.exporter.export.ValueFormats;
import com.kmg.exporter.model.GateDecision;
import com.kmg.exporter.model.GatingParameter;
import com.kmg.exporter.model.JobDefinition;
import com.kmg.exporter.model.ThresholdAlignment;
import com.kmg.exporter.repo.GatingParameterRepository;
import com.kmg.exporter.source.QueryGuard;
import com.kmg.exporter.source.RowBatchHandler;
import com.kmg.exporter.source.SourceConnectionFactory;
import com.kmg.exporter.source.SourceQueryRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks a job's gating parameter: the gating query lists every unit with the date it has advanced
 * to, and the job may only run once no unit is behind the threshold.
 */
@Service
public class GateEvaluator {
    private static final Logger log = LoggerFactory.getLogger(GateEvaluator.class);

    private final GatingParameterRepository parameterRepository;
    private final SourceConnectionFactory connectionFactory;
    private final SourceQueryRunner queryRunner;
    private final ThresholdAlignment alignment;

    @Autowired
    public GateEvaluator(
            GatingParameterRepository parameterRepository,
            SourceConnectionFactory connectionFactory,
            SourceQueryRunner queryRunner,
            ExporterProperties properties
    ) {
        this(parameterRepository, connectionFactory, queryRunner, properties.getGate().getThresholdAlignment());
    }

    public GateEvaluator(
            GatingParameterRepository parameterRepository,
            SourceConnectionFactory connectionFactory,
            SourceQueryRunner queryRunner,
            ThresholdAlignment alignment
    ) {
        this.parameterRepository = parameterRepository;
        this.connectionFactory = connectionFactory;
        this.queryRunner = queryRunner;
        this.alignment = alignment;
    }

    public GateDecision evaluate(JobDefinition job, LocalDate today) {
        if (!job.gated()) {
            return GateDecision.ungated();
        }

        try {
            GatingParameter parameter = parameterRepository.findById(job.gatingParameterId())
                    .orElseThrow(() -> new GateCheckException("Gating parameter not found: " + job.gatingParameterId()));
            QueryGuard.requireReadOnly(parameter.query());

            LocalDate threshold = threshold(today, job.daysOffset());
            List<UnitDate> units = loadUnits(parameter);
            List<String> openUnits = units.stream()
                    .filter(unit -> unit.date().isBefore(threshold))
                    .map(UnitDate::unit)
                    .toList();

            log.debug("Gate '{}' for job {}: {} units, {} open, threshold {}",
                    parameter.name(), job.label(), units.size(), openUnits.size(), threshold);
            if (openUnits.isEmpty()) {
                return GateDecision.ready(threshold);
            }
            return GateDecision.pending(threshold, openUnits);
        } catch (Exception e) {
            log.warn("Gate evaluation failed for job {}: {}", job.label(), e.getMessage());
            return GateDecision.error(e.getMessage());
        }
    }

    public LocalDate threshold(LocalDate today, int daysOffset) {
        LocalDate reference = today.minusDays(daysOffset);
        return switch (alignment) {
            case DAY -> reference;
            case END_OF_MONTH -> reference.withDayOfMonth(1).minusDays(1);
        };
    }

    private List<UnitDate> loadUnits(GatingParameter parameter) throws Exception {
        List<UnitDate> units = new ArrayList<>();
        try (Connection connection = connectionFactory.open()) {
            queryRunner.stream(connection, parameter.query(), List.of(), new RowBatchHandler() {
                @Override
                public void columns(List<String> names) {
                    if (names.size() < 2) {
                        throw new GateCheckException(
                                "Gating query '" + parameter.name() + "' must return a unit and a date column");
                    }
                }

                @Override
                public void batch(List<Object[]> rows) {
                    for (Object[] row : rows) {
                        String unit = String.valueOf(row[0]);
                        LocalDate date = ValueFormats.toDate(row[1]);
                        if (date == null) {
                            throw new GateCheckException("Unparsable date for unit " + unit + ": " + row[1]);
                        }
                        units.add(new UnitDate(unit, date));
                    }
                }
            });
        }
        return units;
    }

    private record UnitDate(String unit, LocalDate date) {
    }

    public static class GateCheckException extends RuntimeException {
        public GateCheckException(String message) {
            super(message);
        }
    }
}
