package com.kmg.exporter.schedule;

import com.kmg.exporter.config.ExporterProperties;
import com.kmg.exporter.model.JobDefinition;
import com.kmg.exporter.service.EventService;
import com.kmg.exporter.service.JobExecutionService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs ready jobs on a bounded worker pool. A job never runs twice at the same time: an occurrence
 * arriving while the previous one is still in flight is dropped.
 */
@Component
public class JobDispatcher {
    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    private final JobExecutionService executionService;
    private final EventService eventService;
    private final ExecutorService executor;
    private final Duration shutdownTimeout;
    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

    @Autowired
    public JobDispatcher(JobExecutionService executionService, EventService eventService, ExporterProperties properties) {
        this(executionService, eventService,
                Executors.newFixedThreadPool(properties.getScheduler().getWorkers()),
                properties.getScheduler().getShutdownTimeout());
    }

    public JobDispatcher(
            JobExecutionService executionService,
            EventService eventService,
            ExecutorService executor,
            Duration shutdownTimeout
    ) {
        this.executionService = executionService;
        this.eventService = eventService;
        this.executor = executor;
        this.shutdownTimeout = shutdownTimeout;
    }

    public boolean submit(JobDefinition job) {
        if (!inFlight.add(job.id())) {
            eventService.warn(job.id(), "Job " + job.label() + " is still running; occurrence dropped");
            return false;
        }
        try {
            executor.execute(() -> run(job));
            return true;
        } catch (RejectedExecutionException e) {
            inFlight.remove(job.id());
            eventService.warn(job.id(), "Dispatcher is shutting down; occurrence of " + job.label() + " dropped");
            return false;
        }
    }

    public Set<Long> inFlight() {
        return Set.copyOf(inFlight);
    }

    private void run(JobDefinition job) {
        try {
            executionService.execute(job);
        } catch (RuntimeException e) {
            log.error("Unhandled error in job {}", job.label(), e);
        } finally {
            inFlight.remove(job.id());
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Jobs still running after {}: {}", shutdownTimeout, inFlight);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
