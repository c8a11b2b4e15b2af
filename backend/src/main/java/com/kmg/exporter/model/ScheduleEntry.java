package com.kmg.exporter.model;

public record ScheduleEntry(
        long id,
        long jobId,
        String day,
        int hour,
        int minute
) {
}
