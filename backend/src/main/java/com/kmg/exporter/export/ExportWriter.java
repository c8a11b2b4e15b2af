package com.kmg.exporter.export;

import com.kmg.exporter.config.ExporterProperties;
import com.kmg.exporter.model.DateWindow;
import com.kmg.exporter.model.JobDefinition;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Builds the {@link ExportSink} matching a job's accumulation policy. All output is UTF-8 CSV with
 * a header row and a fixed field separator.
 */
@Component
public class ExportWriter {
    private static final DateTimeFormatter MONTH_SUFFIX = DateTimeFormatter.ofPattern("MM.yyyy");

    private final CSVFormat format;
    private final CSVFormat readFormat;

    @Autowired
    public ExportWriter(ExporterProperties properties) {
        this(properties.getOutput().getCsvDelimiter());
    }

    public ExportWriter(char delimiter) {
        this.format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setRecordSeparator('\n')
                .build();
        this.readFormat = format.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .build();
    }

    public ExportSink openSink(JobDefinition job, DateWindow window) {
        Path dir = job.exportDir();
        return switch (job.policy()) {
            case ONCE -> new OnceExportSink(this, dir.resolve(job.exportName() + ".csv"));
            case ACCUMULATE -> {
                if (window == null) {
                    throw new IllegalArgumentException("Accumulate export requires a date window");
                }
                yield new AccumulateExportSink(this, dir.resolve(job.exportName() + ".csv"),
                        requireDateColumn(job), window.initialDate());
            }
            case MONTHLY -> new MonthlyExportSink(this, dir, job.exportName(), requireDateColumn(job));
        };
    }

    public ExportSink openOnce(Path target) {
        return new OnceExportSink(this, target);
    }

    public static String monthlyFileName(String baseName, YearMonth month) {
        return baseName + " " + MONTH_SUFFIX.format(month) + ".csv";
    }

    StagedCsvFile stage(Path target, List<String> header) throws IOException {
        return new StagedCsvFile(target, format, header);
    }

    CSVParser read(Path file) throws IOException {
        return CSVParser.parse(Files.newBufferedReader(file, StandardCharsets.UTF_8), readFormat);
    }

    static int indexOfColumn(List<String> names, String column) {
        for (int i = 0; i < names.size(); i++) {
            if (names.get(i).equals(column)) {
                return i;
            }
        }
        for (int i = 0; i < names.size(); i++) {
            if (names.get(i).equalsIgnoreCase(column)) {
                return i;
            }
        }
        return -1;
    }

    static String resolveColumn(List<String> names, String column) {
        int index = indexOfColumn(names, column);
        return index < 0 ? null : names.get(index);
    }

    private String requireDateColumn(JobDefinition job) {
        if (job.dateColumn() == null || job.dateColumn().isBlank()) {
            throw new ExportFailedException("Job " + job.label() + " has no date column for " + job.policy() + " export");
        }
        return job.dateColumn();
    }

    public static class ExportFailedException extends RuntimeException {
        public ExportFailedException(String message) {
            super(message);
        }

        public ExportFailedException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
