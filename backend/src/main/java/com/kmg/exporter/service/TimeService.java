package com.kmg.exporter.service;

import com.kmg.exporter.config.ExporterProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

@Service
public class TimeService {
    private final Clock clock;

    @Autowired
    public TimeService(ExporterProperties properties) {
        this(Clock.system(ZoneId.of(properties.getScheduler().getTimezone())));
    }

    public TimeService(Clock clock) {
        this.clock = clock;
    }

    public ZonedDateTime now() {
        return ZonedDateTime.now(clock);
    }

    public OffsetDateTime nowOffset() {
        return OffsetDateTime.now(clock);
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public ZoneId zoneId() {
        return clock.getZone();
    }
}
