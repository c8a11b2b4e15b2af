package com.kmg.exporter.schedule;

import com.kmg.exporter.config.ExporterProperties;
import com.kmg.exporter.model.GateDecision;
import com.kmg.exporter.model.JobDefinition;
import com.kmg.exporter.repo.JobRepository;
import com.kmg.exporter.service.EventService;
import com.kmg.exporter.service.GateEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Owns the trigger set. Mutated only from the scheduler loop thread; readers get an immutable
 * snapshot.
 */
@Component
public class ExtractionScheduler {
    private static final Logger log = LoggerFactory.getLogger(ExtractionScheduler.class);

    private final RecurrenceResolver recurrenceResolver;
    private final JobRepository jobRepository;
    private final GateEvaluator gateEvaluator;
    private final JobDispatcher dispatcher;
    private final EventService eventService;
    private final Duration gateRetryDelay;

    private volatile List<Trigger> triggers = List.of();

    @Autowired
    public ExtractionScheduler(
            RecurrenceResolver recurrenceResolver,
            JobRepository jobRepository,
            GateEvaluator gateEvaluator,
            JobDispatcher dispatcher,
            EventService eventService,
            ExporterProperties properties
    ) {
        this(recurrenceResolver, jobRepository, gateEvaluator, dispatcher, eventService,
                properties.getScheduler().getGateRetryDelay());
    }

    public ExtractionScheduler(
            RecurrenceResolver recurrenceResolver,
            JobRepository jobRepository,
            GateEvaluator gateEvaluator,
            JobDispatcher dispatcher,
            EventService eventService,
            Duration gateRetryDelay
    ) {
        this.recurrenceResolver = recurrenceResolver;
        this.jobRepository = jobRepository;
        this.gateEvaluator = gateEvaluator;
        this.dispatcher = dispatcher;
        this.eventService = eventService;
        this.gateRetryDelay = gateRetryDelay;
    }

    /**
     * Replaces all triggers, pending gate retries included. On failure the previous set stays.
     *
     * @return whether the new set was installed
     */
    public boolean reload(ZonedDateTime now) {
        try {
            List<Trigger> fresh = recurrenceResolver.resolveAll(now);
            triggers = List.copyOf(fresh);
            long jobs = fresh.stream().mapToLong(Trigger::jobId).distinct().count();
            log.info("Loaded {} triggers for {} jobs", fresh.size(), jobs);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to reload schedules, keeping {} current triggers: {}", triggers.size(), e.getMessage());
            return false;
        }
    }

    public List<Trigger> triggers() {
        return triggers;
    }

    /**
     * Fires every due trigger in fire-time order.
     *
     * @return number of triggers fired
     */
    public int runPending(ZonedDateTime now) {
        List<Trigger> current = triggers;
        List<Trigger> due = new ArrayList<>();
        List<Trigger> next = new ArrayList<>(current.size());
        for (Trigger trigger : current) {
            if (!trigger.isDue(now)) {
                next.add(trigger);
                continue;
            }
            due.add(trigger);
            if (!trigger.oneShot()) {
                next.add(trigger.advance(now));
            }
        }
        if (due.isEmpty()) {
            return 0;
        }

        due.sort(Trigger.BY_FIRE_TIME);
        for (Trigger trigger : due) {
            try {
                fire(trigger, now).ifPresent(next::add);
            } catch (RuntimeException e) {
                log.error("Failed to fire trigger of job {}", trigger.jobId(), e);
                eventService.error(trigger.jobId(), "Trigger failed: " + e.getMessage());
            }
        }

        next.sort(Trigger.BY_FIRE_TIME);
        triggers = List.copyOf(next);
        return due.size();
    }

    public Optional<Duration> untilNextTrigger(ZonedDateTime now) {
        return triggers.stream()
                .min(Trigger.BY_FIRE_TIME)
                .map(trigger -> Duration.between(now, trigger.nextFire()));
    }

    private Optional<Trigger> fire(Trigger trigger, ZonedDateTime now) {
        Optional<JobDefinition> current = jobRepository.findActiveById(trigger.jobId());
        if (current.isEmpty()) {
            log.warn("Job {} is no longer active; skipping occurrence", trigger.jobId());
            return Optional.empty();
        }

        JobDefinition job = current.get();
        GateDecision decision = gateEvaluator.evaluate(job, now.toLocalDate());
        switch (decision.outcome()) {
            case READY -> {
                dispatcher.submit(job);
                return Optional.empty();
            }
            case PENDING -> {
                String units = String.join(", ", decision.openUnits());
                if (trigger.attempt() == 0) {
                    ZonedDateTime retryAt = now.plus(gateRetryDelay);
                    eventService.info(job.id(), "Gate pending for " + job.label() + " (units behind "
                            + decision.threshold() + ": " + units + "); retrying at " + retryAt);
                    return Optional.of(trigger.retry(retryAt, job));
                }
                eventService.warn(job.id(), "Occurrence of " + job.label()
                        + " cancelled; gate still pending for units " + units);
                return Optional.empty();
            }
            default -> {
                eventService.error(job.id(), "Occurrence of " + job.label()
                        + " cancelled; gate evaluation failed: " + decision.error());
                return Optional.empty();
            }
        }
    }
}
