package com.kmg.exporter.service;

import com.kmg.exporter.model.DateWindow;
import com.kmg.exporter.model.JobDefinition;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

@Service
public class DateWindowCalculator {

    /**
     * @return the extraction window of a recurring job, or null for a {@code ONCE} job whose query
     * bounds itself
     */
    public DateWindow compute(JobDefinition job, LocalDate today) {
        if (!job.policy().usesDateWindow()) {
            return null;
        }
        return compute(job.lastProcessedDate(), job.daysOffset(), today);
    }

    /**
     * The window restarts at the first day of the month following the last processed date, so a
     * partially extracted month is always re-extracted in full. A job that never ran starts at the
     * first day of the final date's month.
     */
    public DateWindow compute(LocalDate lastProcessedDate, int daysOffset, LocalDate today) {
        LocalDate finalDate = today.minusDays(daysOffset);
        LocalDate initialDate = lastProcessedDate == null
                ? finalDate.withDayOfMonth(1)
                : lastProcessedDate.plusDays(1).withDayOfMonth(1);
        return new DateWindow(initialDate, finalDate);
    }
}
