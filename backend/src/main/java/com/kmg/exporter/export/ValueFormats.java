package com.kmg.exporter.export;

import java.math.BigDecimal;
import java.sql.Clob;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Text rendering of JDBC values for CSV output, and date parsing of the date column in both fresh
 * rows and previously written files.
 */
public final class ValueFormats {
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter DAY_FIRST = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    private ValueFormats() {
    }

    public static String format(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate().toString();
        }
        if (value instanceof Timestamp timestamp) {
            return formatDateTime(timestamp.toLocalDateTime());
        }
        if (value instanceof LocalDate date) {
            return date.toString();
        }
        if (value instanceof LocalDateTime dateTime) {
            return formatDateTime(dateTime);
        }
        if (value instanceof OffsetDateTime dateTime) {
            return formatDateTime(dateTime.toLocalDateTime());
        }
        if (value instanceof java.util.Date date) {
            return formatDateTime(LocalDateTime.ofInstant(date.toInstant(), ZoneId.systemDefault()));
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (value instanceof Double || value instanceof Float) {
            return new BigDecimal(value.toString()).toPlainString();
        }
        if (value instanceof Clob clob) {
            try {
                return clob.getSubString(1, (int) clob.length());
            } catch (SQLException e) {
                throw new IllegalStateException("Failed to read CLOB value: " + e.getMessage(), e);
            }
        }
        return value.toString();
    }

    /**
     * @return the calendar date carried by {@code value}, or null when it is empty or not a date
     */
    public static LocalDate toDate(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate();
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toLocalDateTime().toLocalDate();
        }
        if (value instanceof LocalDate date) {
            return date;
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (value instanceof OffsetDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (value instanceof java.util.Date date) {
            return LocalDate.ofInstant(date.toInstant(), ZoneId.systemDefault());
        }
        return parseDate(value.toString());
    }

    public static LocalDate parseDate(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String value = text.trim();
        if (value.length() < 10) {
            return null;
        }
        try {
            if (value.charAt(4) == '-') {
                return LocalDate.parse(value.substring(0, 10));
            }
            if (value.charAt(2) == '/') {
                return LocalDate.parse(value.substring(0, 10), DAY_FIRST);
            }
        } catch (DateTimeParseException e) {
            return null;
        }
        return null;
    }

    private static String formatDateTime(LocalDateTime dateTime) {
        if (dateTime.toLocalTime().equals(LocalTime.MIDNIGHT)) {
            return dateTime.toLocalDate().toString();
        }
        return DATE_TIME.format(dateTime);
    }
}
