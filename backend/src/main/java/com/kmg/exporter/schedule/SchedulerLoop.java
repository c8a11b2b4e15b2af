package com.kmg.exporter.schedule;

import com.kmg.exporter.config.ExporterProperties;
import com.kmg.exporter.service.EventualJobService;
import com.kmg.exporter.service.Sleeper;
import com.kmg.exporter.service.TimeService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The single thread that reloads schedules, fires due triggers and drains eventual requests. An
 * error in one cycle is logged and the loop carries on after {@code errorSleep}.
 */
@Component
public class SchedulerLoop implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(SchedulerLoop.class);
    static final Duration MIN_SLEEP = Duration.ofSeconds(1);

    private final ExtractionScheduler scheduler;
    private final EventualJobService eventualJobService;
    private final TimeService timeService;
    private final ExporterProperties.Scheduler settings;
    private final Sleeper sleeper;
    private final AtomicBoolean reloadRequested = new AtomicBoolean();

    private volatile boolean running;
    private Thread thread;
    private ZonedDateTime nextReloadAt;

    @Autowired
    public SchedulerLoop(
            ExtractionScheduler scheduler,
            EventualJobService eventualJobService,
            TimeService timeService,
            ExporterProperties properties
    ) {
        this(scheduler, eventualJobService, timeService, properties.getScheduler(), Sleeper.THREAD);
    }

    public SchedulerLoop(
            ExtractionScheduler scheduler,
            EventualJobService eventualJobService,
            TimeService timeService,
            ExporterProperties.Scheduler settings,
            Sleeper sleeper
    ) {
        this.scheduler = scheduler;
        this.eventualJobService = eventualJobService;
        this.timeService = timeService;
        this.settings = settings;
        this.sleeper = sleeper;
    }

    public synchronized void start() {
        if (thread != null) {
            return;
        }
        running = true;
        thread = new Thread(this, "extraction-scheduler");
        thread.start();
    }

    @PreDestroy
    public synchronized void stop() {
        running = false;
        if (thread == null) {
            return;
        }
        thread.interrupt();
        try {
            thread.join(settings.getStopTimeout().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        thread = null;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Picked up at the start of the next cycle.
     */
    public void requestReload() {
        reloadRequested.set(true);
    }

    @Override
    public void run() {
        log.info("Scheduler loop started in zone {}", timeService.zoneId());
        while (running) {
            Duration pause;
            try {
                pause = runCycle();
            } catch (RuntimeException e) {
                log.error("Scheduler cycle failed; resuming in {}", settings.getErrorSleep(), e);
                pause = settings.getErrorSleep();
            }

            try {
                sleeper.sleep(pause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("Scheduler loop stopped");
    }

    /**
     * @return how long to sleep before the next cycle
     */
    Duration runCycle() {
        ZonedDateTime now = timeService.now();
        // Due triggers fire before a reload rebuilds them strictly after now.
        int fired = scheduler.runPending(now);
        if (fired > 0) {
            log.debug("Fired {} triggers", fired);
        }

        if (reloadRequested.getAndSet(false) || nextReloadAt == null || !now.isBefore(nextReloadAt)) {
            scheduler.reload(now);
            nextReloadAt = now.plus(settings.getReloadInterval());
        }
        eventualJobService.drain();
        return idleDuration(timeService.now());
    }

    Duration idleDuration(ZonedDateTime now) {
        Optional<Duration> untilNext = scheduler.untilNextTrigger(now);
        if (untilNext.isEmpty()) {
            return settings.getIdleSleep();
        }
        Duration pause = untilNext.get();
        if (pause.compareTo(settings.getIdleCap()) > 0) {
            pause = settings.getIdleCap();
        }
        return pause.compareTo(MIN_SLEEP) < 0 ? MIN_SLEEP : pause;
    }
}
