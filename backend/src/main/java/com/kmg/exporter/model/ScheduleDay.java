package com.kmg.exporter.model;

import java.time.DayOfWeek;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public enum ScheduleDay {
    MON(DayOfWeek.MONDAY, "SEG"),
    TUE(DayOfWeek.TUESDAY, "TER"),
    WED(DayOfWeek.WEDNESDAY, "QUA"),
    THU(DayOfWeek.THURSDAY, "QUI"),
    FRI(DayOfWeek.FRIDAY, "SEX"),
    SAT(DayOfWeek.SATURDAY, "SAB", "SÁB"),
    SUN(DayOfWeek.SUNDAY, "DOM"),
    EVERY(null, "TODOS");

    private final DayOfWeek dayOfWeek;
    private final List<String> aliases;

    ScheduleDay(DayOfWeek dayOfWeek, String... aliases) {
        this.dayOfWeek = dayOfWeek;
        this.aliases = List.of(aliases);
    }

    public Set<DayOfWeek> daysOfWeek() {
        if (dayOfWeek == null) {
            return EnumSet.allOf(DayOfWeek.class);
        }
        return EnumSet.of(dayOfWeek);
    }

    /**
     * Accepts three-letter codes, full English day names, {@code EVERY} and the Portuguese codes
     * already present in the job store ({@code Seg} .. {@code Dom}, {@code Todos}), ignoring case.
     */
    public static Optional<ScheduleDay> parse(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        for (ScheduleDay day : values()) {
            if (day.name().equals(normalized) || day.aliases.contains(normalized)) {
                return Optional.of(day);
            }
            if (day.dayOfWeek != null && day.dayOfWeek.name().equals(normalized)) {
                return Optional.of(day);
            }
        }
        return Optional.empty();
    }
}
