package com.kmg.exporter.model;

import java.nio.file.Path;
import java.util.List;

public record ExecutionResult(
        long jobId,
        ExecutionStatus status,
        long rows,
        List<Path> files,
        long durationMs,
        String error
) {
    public boolean succeeded() {
        return status == ExecutionStatus.COMPLETED;
    }
}
