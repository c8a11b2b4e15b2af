package com.kmg.exporter.service;

import com.kmg.exporter.model.AccumulationPolicy;
import com.kmg.exporter.model.DateWindow;
import com.kmg.exporter.model.JobDefinition;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class DateWindowCalculatorTest {

    private final DateWindowCalculator calculator = new DateWindowCalculator();

    @Test
    void shouldRestartAtFirstDayOfMonthAfterLastProcessedDate() {
        DateWindow window = calculator.compute(LocalDate.of(2024, 3, 10), 1, LocalDate.of(2024, 3, 18));

        assertEquals(LocalDate.of(2024, 3, 1), window.initialDate());
        assertEquals(LocalDate.of(2024, 3, 17), window.finalDate());
        assertFalse(window.spansMonths());
    }

    @Test
    void shouldMoveToNextMonthWhenLastProcessedDateClosedTheMonth() {
        DateWindow window = calculator.compute(LocalDate.of(2024, 2, 29), 0, LocalDate.of(2024, 3, 4));

        assertEquals(LocalDate.of(2024, 3, 1), window.initialDate());
        assertEquals(LocalDate.of(2024, 3, 4), window.finalDate());
    }

    @Test
    void shouldSpanMonthsWhenOffsetCrossesMonthBoundary() {
        DateWindow window = calculator.compute(LocalDate.of(2024, 1, 20), 5, LocalDate.of(2024, 3, 3));

        assertEquals(LocalDate.of(2024, 1, 1), window.initialDate());
        assertEquals(LocalDate.of(2024, 2, 27), window.finalDate());
        assertTrue(window.spansMonths());
    }

    @Test
    void shouldCrossYearBoundary() {
        DateWindow window = calculator.compute(LocalDate.of(2023, 12, 31), 0, LocalDate.of(2024, 1, 10));

        assertEquals(LocalDate.of(2024, 1, 1), window.initialDate());
        assertEquals(LocalDate.of(2024, 1, 10), window.finalDate());

        DateWindow next = calculator.compute(LocalDate.of(2023, 12, 20), 0, LocalDate.of(2024, 1, 5));
        assertEquals(LocalDate.of(2023, 12, 1), next.initialDate());
        assertTrue(next.spansMonths());
    }

    @Test
    void shouldStartAtMonthOfFinalDateWhenNeverProcessed() {
        DateWindow window = calculator.compute(null, 2, LocalDate.of(2024, 3, 1));

        assertEquals(LocalDate.of(2024, 2, 1), window.initialDate());
        assertEquals(LocalDate.of(2024, 2, 28), window.finalDate());
    }

    @Test
    void shouldNotComputeWindowForOnceJobs() {
        JobDefinition job = new JobDefinition(1, "Snapshot", true, "SELECT 1 FROM DUAL", "/tmp", "snapshot",
                AccumulationPolicy.ONCE, 0, null, null, null, null, LocalDate.of(2024, 1, 1));

        assertNull(calculator.compute(job, LocalDate.of(2024, 3, 1)));
    }
}
