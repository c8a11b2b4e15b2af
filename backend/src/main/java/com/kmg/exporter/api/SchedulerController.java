package com.kmg.exporter.api;

import com.kmg.exporter.dto.ExecutionEventView;
import com.kmg.exporter.dto.TriggerView;
import com.kmg.exporter.schedule.ExtractionScheduler;
import com.kmg.exporter.schedule.JobDispatcher;
import com.kmg.exporter.schedule.SchedulerLoop;
import com.kmg.exporter.service.EventService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Set;

@RestController
@RequestMapping("/api/scheduler")
public class SchedulerController {
    private final ExtractionScheduler scheduler;
    private final JobDispatcher dispatcher;
    private final SchedulerLoop schedulerLoop;
    private final EventService eventService;

    public SchedulerController(
            ExtractionScheduler scheduler,
            JobDispatcher dispatcher,
            SchedulerLoop schedulerLoop,
            EventService eventService
    ) {
        this.scheduler = scheduler;
        this.dispatcher = dispatcher;
        this.schedulerLoop = schedulerLoop;
        this.eventService = eventService;
    }

    @GetMapping("/triggers")
    public List<TriggerView> triggers() {
        Set<Long> running = dispatcher.inFlight();
        return scheduler.triggers().stream()
                .map(trigger -> new TriggerView(
                        trigger.jobId(),
                        trigger.job().name(),
                        trigger.scheduleId(),
                        trigger.dayOfWeek().name(),
                        trigger.time().toString(),
                        trigger.nextFire().toOffsetDateTime().toString(),
                        trigger.attempt(),
                        trigger.oneShot(),
                        running.contains(trigger.jobId())
                ))
                .toList();
    }

    @PostMapping("/reload")
    public ResponseEntity<Void> reload() {
        schedulerLoop.requestReload();
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/events")
    public List<ExecutionEventView> events(@RequestParam(defaultValue = "50") int limit) {
        return eventService.recent(limit).stream()
                .map(event -> new ExecutionEventView(
                        event.id(),
                        event.createdAt() == null ? null : event.createdAt().toString(),
                        event.level(),
                        event.jobId(),
                        event.message(),
                        event.durationMs()
                ))
                .toList();
    }
}
