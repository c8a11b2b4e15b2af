package com.kmg.exporter.dto;

import com.kmg.exporter.model.EventLevel;

public record ExecutionEventView(
        long id,
        String createdAt,
        EventLevel level,
        Long jobId,
        String message,
        Long durationMs
) {
}
