package com.kmg.exporter.service;

import com.kmg.exporter.model.DateWindow;
import com.kmg.exporter.model.JobDefinition;
import com.kmg.exporter.repo.JobRepository;
import org.springframework.stereotype.Service;

@Service
public class BookkeepingService {
    private final JobRepository jobRepository;
    private final TimeService timeService;

    public BookkeepingService(JobRepository jobRepository, TimeService timeService) {
        this.jobRepository = jobRepository;
        this.timeService = timeService;
    }

    /**
     * Only called after the export was committed; a failed run leaves the previous values so the
     * next occurrence extracts the same window again.
     */
    public void recordSuccess(JobDefinition job, DateWindow window) {
        jobRepository.updateLastExecution(
                job.id(),
                timeService.nowOffset(),
                window == null ? null : window.finalDate()
        );
    }
}
