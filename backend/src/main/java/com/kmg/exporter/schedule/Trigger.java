package com.kmg.exporter.schedule;

import com.kmg.exporter.model.JobDefinition;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.Comparator;

/**
 * One pending firing of a job. Recurring triggers advance to the next week after firing; one-shot
 * triggers are gate retries and are dropped once fired.
 */
public record Trigger(
        long jobId,
        long scheduleId,
        DayOfWeek dayOfWeek,
        LocalTime time,
        ZonedDateTime nextFire,
        int attempt,
        boolean oneShot,
        JobDefinition job
) {
    public static final Comparator<Trigger> BY_FIRE_TIME = Comparator
            .comparing((Trigger t) -> t.nextFire().toInstant())
            .thenComparingLong(Trigger::jobId)
            .thenComparingLong(Trigger::scheduleId);

    public static Trigger recurring(JobDefinition job, long scheduleId, DayOfWeek day, LocalTime time, ZonedDateTime now) {
        return new Trigger(job.id(), scheduleId, day, time, nextOccurrence(day, time, now), 0, false, job);
    }

    /**
     * First instant strictly after {@code after} that falls on the given weekday at the given
     * wall-clock time in the zone of {@code after}.
     */
    public static ZonedDateTime nextOccurrence(DayOfWeek day, LocalTime time, ZonedDateTime after) {
        LocalDate date = after.toLocalDate().with(TemporalAdjusters.nextOrSame(day));
        ZonedDateTime candidate = ZonedDateTime.of(date, time, after.getZone());
        if (!candidate.isAfter(after)) {
            candidate = ZonedDateTime.of(date.plusWeeks(1), time, after.getZone());
        }
        return candidate;
    }

    public Trigger advance(ZonedDateTime now) {
        return new Trigger(jobId, scheduleId, dayOfWeek, time, nextOccurrence(dayOfWeek, time, now), 0, false, job);
    }

    public Trigger retry(ZonedDateTime fireAt, JobDefinition current) {
        return new Trigger(jobId, scheduleId, dayOfWeek, time, fireAt, attempt + 1, true, current);
    }

    public boolean isDue(ZonedDateTime now) {
        return !nextFire.isAfter(now);
    }
}
