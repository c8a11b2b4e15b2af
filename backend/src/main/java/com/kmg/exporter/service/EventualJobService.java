package com.kmg.exporter.service;

import com.kmg.exporter.config.ExporterProperties;
import com.kmg.exporter.export.ExportWriter;
import com.kmg.exporter.model.EventLevel;
import com.kmg.exporter.model.EventualRequest;
import com.kmg.exporter.model.ExportOutcome;
import com.kmg.exporter.repo.EventualRequestRepository;
import com.kmg.exporter.source.QueryGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Drains ad-hoc export requests. Each request gets exactly one attempt and is removed from the
 * store afterwards whether it succeeded or not.
 */
@Service
public class EventualJobService {
    private static final Logger log = LoggerFactory.getLogger(EventualJobService.class);

    private final EventualRequestRepository requestRepository;
    private final ExtractionService extractionService;
    private final ExportWriter exportWriter;
    private final EventService eventService;
    private final Path eventualDir;

    @Autowired
    public EventualJobService(
            EventualRequestRepository requestRepository,
            ExtractionService extractionService,
            ExportWriter exportWriter,
            EventService eventService,
            ExporterProperties properties
    ) {
        this(requestRepository, extractionService, exportWriter, eventService,
                Path.of(properties.getOutput().getEventualDir()));
    }

    public EventualJobService(
            EventualRequestRepository requestRepository,
            ExtractionService extractionService,
            ExportWriter exportWriter,
            EventService eventService,
            Path eventualDir
    ) {
        this.requestRepository = requestRepository;
        this.extractionService = extractionService;
        this.exportWriter = exportWriter;
        this.eventService = eventService;
        this.eventualDir = eventualDir;
    }

    /**
     * @return number of requests attempted
     */
    public int drain() {
        List<EventualRequest> pending;
        try {
            pending = requestRepository.findAll();
        } catch (DataAccessException e) {
            log.error("Failed to read eventual requests: {}", e.getMessage());
            return 0;
        }

        for (EventualRequest request : pending) {
            process(request);
        }
        return pending.size();
    }

    private void process(EventualRequest request) {
        long started = System.nanoTime();
        try {
            QueryGuard.requireReadOnly(request.query());
            Path target = targetFor(request.exportName());
            ExportOutcome outcome = extractionService.run(request.query(), List.of(), exportWriter.openOnce(target));
            eventService.publish(EventLevel.INFO, null,
                    "Eventual export '" + request.exportName() + "' finished: " + outcome.rows() + " rows to " + target,
                    elapsedMs(started));
        } catch (Exception e) {
            eventService.publish(EventLevel.ERROR, null,
                    "Eventual export '" + request.exportName() + "' failed: " + e.getMessage(),
                    elapsedMs(started));
        } finally {
            try {
                requestRepository.delete(request.id());
            } catch (DataAccessException e) {
                log.error("Failed to remove eventual request {}: {}", request.id(), e.getMessage());
            }
        }
    }

    Path targetFor(String exportName) {
        if (exportName == null || exportName.isBlank()
                || exportName.contains("/") || exportName.contains("\\") || exportName.contains("..")) {
            throw new IllegalArgumentException("Invalid export name: " + exportName);
        }
        return eventualDir.resolve(exportName + ".csv");
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }
}
