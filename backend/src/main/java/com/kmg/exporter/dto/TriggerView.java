package com.kmg.exporter.dto;

public record TriggerView(
        long jobId,
        String jobName,
        long scheduleId,
        String dayOfWeek,
        String time,
        String nextFire,
        int attempt,
        boolean oneShot,
        boolean running
) {
}
