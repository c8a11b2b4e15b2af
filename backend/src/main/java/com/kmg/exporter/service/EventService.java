package com.kmg.exporter.service;

import com.kmg.exporter.model.EventLevel;
import com.kmg.exporter.model.ExecutionEvent;
import com.kmg.exporter.repo.ExecutionEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Structured execution events: every event goes to the application log and is appended to the
 * {@code execution_events} table. A failing insert never propagates to the caller.
 */
@Service
public class EventService {
    private static final Logger log = LoggerFactory.getLogger(EventService.class);

    private final ExecutionEventRepository eventRepository;

    public EventService(ExecutionEventRepository eventRepository) {
        this.eventRepository = eventRepository;
    }

    public void info(Long jobId, String message) {
        publish(EventLevel.INFO, jobId, message, null);
    }

    public void warn(Long jobId, String message) {
        publish(EventLevel.WARN, jobId, message, null);
    }

    public void error(Long jobId, String message) {
        publish(EventLevel.ERROR, jobId, message, null);
    }

    public void publish(EventLevel level, Long jobId, String message, Long durationMs) {
        String line = durationMs == null
                ? "[job={}] {}"
                : "[job={}] {} ({} ms)";
        Object[] args = durationMs == null
                ? new Object[]{jobId == null ? "-" : jobId, message}
                : new Object[]{jobId == null ? "-" : jobId, message, durationMs};
        switch (level) {
            case DEBUG -> log.debug(line, args);
            case INFO -> log.info(line, args);
            case WARN -> log.warn(line, args);
            case ERROR -> log.error(line, args);
        }

        if (level == EventLevel.DEBUG) {
            return;
        }
        try {
            eventRepository.insert(level, jobId, message, durationMs);
        } catch (Exception e) {
            log.warn("Failed to persist execution event: {}", e.getMessage());
        }
    }

    public List<ExecutionEvent> recent(int limit) {
        return eventRepository.findRecent(Math.max(1, Math.min(limit, 500)));
    }
}
