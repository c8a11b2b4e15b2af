package com.kmg.exporter.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.exporter.config.ExporterProperties;
import com.kmg.exporter.export.ExportWriter;
import com.kmg.exporter.model.DateWindow;
import com.kmg.exporter.model.EventLevel;
import com.kmg.exporter.model.ExecutionResult;
import com.kmg.exporter.model.ExecutionStatus;
import com.kmg.exporter.model.ExportOutcome;
import com.kmg.exporter.model.JobDefinition;
import com.kmg.exporter.source.QueryGuard;
import com.kmg.exporter.source.SourceQueryRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one occurrence of a job: validates its query, extracts the date window, writes the export
 * per the job's policy and records bookkeeping. Every outcome is reported as an
 * {@link ExecutionResult}; nothing escapes to the worker thread.
 */
@Service
public class JobExecutionService {
    private static final Logger log = LoggerFactory.getLogger(JobExecutionService.class);
    private static final DateTimeFormatter REPORT_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final DateWindowCalculator windowCalculator;
    private final ExtractionService extractionService;
    private final ExportWriter exportWriter;
    private final BookkeepingService bookkeepingService;
    private final EventService eventService;
    private final TimeService timeService;
    private final ObjectMapper objectMapper;
    private final Path reportDir;

    @Autowired
    public JobExecutionService(
            DateWindowCalculator windowCalculator,
            ExtractionService extractionService,
            ExportWriter exportWriter,
            BookkeepingService bookkeepingService,
            EventService eventService,
            TimeService timeService,
            ObjectMapper objectMapper,
            ExporterProperties properties
    ) {
        this(windowCalculator, extractionService, exportWriter, bookkeepingService, eventService, timeService,
                objectMapper, Path.of(properties.getOutput().getReportDir()));
    }

    public JobExecutionService(
            DateWindowCalculator windowCalculator,
            ExtractionService extractionService,
            ExportWriter exportWriter,
            BookkeepingService bookkeepingService,
            EventService eventService,
            TimeService timeService,
            ObjectMapper objectMapper,
            Path reportDir
    ) {
        this.windowCalculator = windowCalculator;
        this.extractionService = extractionService;
        this.exportWriter = exportWriter;
        this.bookkeepingService = bookkeepingService;
        this.eventService = eventService;
        this.timeService = timeService;
        this.objectMapper = objectMapper;
        this.reportDir = reportDir;
    }

    public ExecutionResult execute(JobDefinition job) {
        long started = System.nanoTime();
        String startedAt = timeService.nowOffset().toString();
        MDC.put("jobId", String.valueOf(job.id()));

        DateWindow window = null;
        ExecutionResult result;
        try {
            eventService.info(job.id(), "Starting job " + job.label() + " [" + job.policy() + "]");
            QueryGuard.requireReadOnly(job.query());

            window = windowCalculator.compute(job, timeService.today());
            if (window != null) {
                log.info("Extraction window for {}: {} .. {}", job.label(), window.initialDate(), window.finalDate());
            }

            List<Object> binds = window == null ? List.of() : window.bindValues();
            ExportOutcome outcome = extractionService.run(job.query(), binds, exportWriter.openSink(job, window));
            bookkeepingService.recordSuccess(job, window);

            long duration = elapsedMs(started);
            eventService.publish(EventLevel.INFO, job.id(),
                    "Job " + job.label() + " finished: " + outcome.rows() + " rows, " + outcome.files().size() + " file(s)",
                    duration);
            result = new ExecutionResult(job.id(), ExecutionStatus.COMPLETED, outcome.rows(), outcome.files(), duration, null);
        } catch (QueryGuard.ReadOnlyViolationException e) {
            result = failed(job, started, "rejected", e);
        } catch (SourceQueryRunner.ExtractionFailedException | SQLException e) {
            result = failed(job, started, "extraction failed", e);
        } catch (ExportWriter.ExportFailedException | IOException | UncheckedIOException e) {
            result = failed(job, started, "export failed", e);
        } catch (DataAccessException e) {
            result = failed(job, started, "export written but bookkeeping failed", e);
        } catch (RuntimeException e) {
            log.error("Unexpected error running job {}", job.label(), e);
            result = failed(job, started, "unexpected error", e);
        }

        try {
            writeReport(job, window, startedAt, result);
        } finally {
            MDC.remove("jobId");
        }
        return result;
    }

    private ExecutionResult failed(JobDefinition job, long started, String reason, Exception e) {
        long duration = elapsedMs(started);
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        eventService.publish(EventLevel.ERROR, job.id(), "Job " + job.label() + " " + reason + ": " + message, duration);
        return new ExecutionResult(job.id(), ExecutionStatus.FAILED, 0, List.of(), duration, message);
    }

    private void writeReport(JobDefinition job, DateWindow window, String startedAt, ExecutionResult result) {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("jobId", job.id());
        report.put("name", job.name());
        report.put("policy", job.policy().name());
        report.put("startedAt", startedAt);
        report.put("endedAt", timeService.nowOffset().toString());
        if (window != null) {
            report.put("initialDate", window.initialDate().toString());
            report.put("finalDate", window.finalDate().toString());
        }
        report.put("status", result.status().name());
        report.put("rows", result.rows());
        report.put("files", result.files().stream().map(Path::toString).toList());
        report.put("durationMs", result.durationMs());
        if (result.error() != null) {
            report.put("error", result.error());
        }

        try {
            Files.createDirectories(reportDir);
            Path reportPath = reportDir.resolve(job.id() + "-" + REPORT_STAMP.format(timeService.now()) + ".json");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(reportPath.toFile(), report);
        } catch (IOException e) {
            log.warn("Failed to write report for {}: {}", job.label(), e.getMessage());
        }
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }
}
