package com.kmg.exporter.model;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;

/**
 * Inclusive extraction bounds of a recurring job run.
 */
public record DateWindow(LocalDate initialDate, LocalDate finalDate) {

    public boolean spansMonths() {
        return !YearMonth.from(initialDate).equals(YearMonth.from(finalDate));
    }

    public List<Object> bindValues() {
        return List.of(java.sql.Date.valueOf(initialDate), java.sql.Date.valueOf(finalDate));
    }
}
