package com.kmg.exporter.repo;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

public final class SqlTime {
    private SqlTime() {
    }

    public static String nowText() {
        return OffsetDateTime.now(ZoneOffset.UTC).toString();
    }

    public static OffsetDateTime parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return OffsetDateTime.parse(value);
    }

    public static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return LocalDate.parse(value);
    }

    public static String toText(Object value) {
        return value == null ? null : value.toString();
    }
}
