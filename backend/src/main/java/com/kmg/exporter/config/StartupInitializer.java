package com.kmg.exporter.config;

import com.kmg.exporter.repo.StoreSchemaInitializer;
import com.kmg.exporter.schedule.SchedulerLoop;
import com.kmg.exporter.source.SourceConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class StartupInitializer implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StartupInitializer.class);

    private final ExporterProperties properties;
    private final StoreSchemaInitializer schemaInitializer;
    private final SourceConnectionFactory connectionFactory;
    private final SchedulerLoop schedulerLoop;

    public StartupInitializer(
            ExporterProperties properties,
            StoreSchemaInitializer schemaInitializer,
            SourceConnectionFactory connectionFactory,
            SchedulerLoop schedulerLoop
    ) {
        this.properties = properties;
        this.schemaInitializer = schemaInitializer;
        this.connectionFactory = connectionFactory;
        this.schedulerLoop = schedulerLoop;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        createDirectories();
        schemaInitializer.initialize();

        if (properties.getSource().isVerifyOnStartup()) {
            connectionFactory.verify(properties.getSource().getValidationQuery());
            log.info("Source database reachable at {}", properties.getSource().getUrl());
        }

        if (properties.getScheduler().isEnabled()) {
            schedulerLoop.start();
        } else {
            log.info("Scheduler disabled; only the status API is served");
        }
    }

    private void createDirectories() throws IOException {
        Files.createDirectories(properties.baseDirPath());
        Files.createDirectories(Path.of(properties.getOutput().getEventualDir()));
        Files.createDirectories(Path.of(properties.getOutput().getReportDir()));
        Files.createDirectories(Path.of(properties.getLogs().getDir()));
        Path dbPath = Path.of(properties.getState().getDbPath());
        if (dbPath.getParent() != null) {
            Files.createDirectories(dbPath.getParent());
        }
    }
}
