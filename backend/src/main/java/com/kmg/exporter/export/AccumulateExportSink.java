package com.kmg.exporter.export;

import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rolling history file: rows dated before the window start are carried over from the current file,
 * everything from the window start on is replaced by the freshly extracted rows.
 */
class AccumulateExportSink implements ExportSink {
    private static final Logger log = LoggerFactory.getLogger(AccumulateExportSink.class);

    private final ExportWriter writer;
    private final Path target;
    private final String dateColumn;
    private final LocalDate initialDate;
    private StagedCsvFile staged;

    AccumulateExportSink(ExportWriter writer, Path target, String dateColumn, LocalDate initialDate) {
        this.writer = writer;
        this.target = target;
        this.dateColumn = dateColumn;
        this.initialDate = initialDate;
    }

    @Override
    public void columns(List<String> names) throws IOException {
        if (ExportWriter.indexOfColumn(names, dateColumn) < 0) {
            throw new ExportWriter.ExportFailedException(
                    "Date column '" + dateColumn + "' is not part of the result " + names);
        }
        staged = writer.stage(target, names);
        if (Files.exists(target)) {
            carryOverHistory(names);
        }
    }

    private void carryOverHistory(List<String> names) throws IOException {
        int kept = 0;
        int dropped = 0;
        try (CSVParser parser = writer.read(target)) {
            List<String> existingHeader = parser.getHeaderNames();
            String existingDateColumn = ExportWriter.resolveColumn(existingHeader, dateColumn);
            if (existingDateColumn == null) {
                throw new ExportWriter.ExportFailedException(
                        "Existing file " + target + " has no date column '" + dateColumn + "'");
            }
            List<String> mapping = new ArrayList<>(names.size());
            for (String name : names) {
                mapping.add(ExportWriter.resolveColumn(existingHeader, name));
            }

            for (CSVRecord record : parser) {
                LocalDate date = ValueFormats.parseDate(record.get(existingDateColumn));
                if (date != null && !date.isBefore(initialDate)) {
                    dropped++;
                    continue;
                }
                Map<String, String> values = record.toMap();
                List<String> row = new ArrayList<>(mapping.size());
                for (String column : mapping) {
                    String value = column == null ? null : values.get(column);
                    row.add(value == null ? "" : value);
                }
                staged.printValues(row);
                kept++;
            }
        }
        log.debug("Carried over {} rows from {} and dropped {} rows on or after {}",
                kept, target, dropped, initialDate);
    }

    @Override
    public void batch(List<Object[]> rows) throws IOException {
        for (Object[] row : rows) {
            staged.printRow(row);
        }
    }

    @Override
    public List<Path> commit() throws IOException {
        if (staged == null) {
            throw new IllegalStateException("No result columns received for " + target);
        }
        return List.of(staged.commit());
    }

    @Override
    public void close() {
        if (staged != null) {
            staged.discard();
        }
    }
}
