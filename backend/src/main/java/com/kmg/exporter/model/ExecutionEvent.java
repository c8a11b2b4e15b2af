package com.kmg.exporter.model;

import java.time.OffsetDateTime;

public record ExecutionEvent(
        long id,
        OffsetDateTime createdAt,
        EventLevel level,
        Long jobId,
        String message,
        Long durationMs
) {
}
