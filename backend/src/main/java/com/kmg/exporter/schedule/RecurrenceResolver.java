package com.kmg.exporter.schedule;

import com.kmg.exporter.model.JobDefinition;
import com.kmg.exporter.model.ScheduleDay;
import com.kmg.exporter.model.ScheduleEntry;
import com.kmg.exporter.repo.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns the active jobs and their schedule entries into triggers. Entries with an unknown day or an
 * out-of-range time are skipped with a warning instead of failing the whole load.
 */
@Component
public class RecurrenceResolver {
    private static final Logger log = LoggerFactory.getLogger(RecurrenceResolver.class);

    private final JobRepository jobRepository;

    public RecurrenceResolver(JobRepository jobRepository) {
        this.jobRepository = jobRepository;
    }

    /**
     * Reading the job list itself is allowed to fail; the caller keeps its previous triggers then.
     */
    public List<Trigger> resolveAll(ZonedDateTime now) {
        List<Trigger> triggers = new ArrayList<>();
        for (JobDefinition job : jobRepository.findActiveJobs()) {
            try {
                triggers.addAll(resolve(job, jobRepository.findScheduleEntries(job.id()), now));
            } catch (DataAccessException e) {
                log.warn("Failed to load schedule of job {}: {}", job.label(), e.getMessage());
            }
        }
        triggers.sort(Trigger.BY_FIRE_TIME);
        return triggers;
    }

    public List<Trigger> resolve(JobDefinition job, List<ScheduleEntry> entries, ZonedDateTime now) {
        List<Trigger> triggers = new ArrayList<>();
        for (ScheduleEntry entry : entries) {
            Optional<ScheduleDay> day = ScheduleDay.parse(entry.day());
            if (day.isEmpty()) {
                log.warn("Skipping schedule {} of job {}: unknown day '{}'", entry.id(), job.label(), entry.day());
                continue;
            }
            if (entry.hour() < 0 || entry.hour() > 23 || entry.minute() < 0 || entry.minute() > 59) {
                log.warn("Skipping schedule {} of job {}: invalid time {}:{}",
                        entry.id(), job.label(), entry.hour(), entry.minute());
                continue;
            }

            LocalTime time = LocalTime.of(entry.hour(), entry.minute());
            for (DayOfWeek dayOfWeek : day.get().daysOfWeek()) {
                triggers.add(Trigger.recurring(job, entry.id(), dayOfWeek, time, now));
            }
        }
        return triggers;
    }
}
