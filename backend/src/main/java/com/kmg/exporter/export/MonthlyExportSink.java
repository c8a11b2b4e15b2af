package com.kmg.exporter.export;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * One file per calendar month of the date column; each month's file is rewritten in full.
 */
class MonthlyExportSink implements ExportSink {
    private final ExportWriter writer;
    private final Path dir;
    private final String baseName;
    private final String dateColumn;
    private final Map<YearMonth, StagedCsvFile> files = new TreeMap<>();
    private List<String> header;
    private int dateIndex = -1;

    MonthlyExportSink(ExportWriter writer, Path dir, String baseName, String dateColumn) {
        this.writer = writer;
        this.dir = dir;
        this.baseName = baseName;
        this.dateColumn = dateColumn;
    }

    @Override
    public void columns(List<String> names) {
        dateIndex = ExportWriter.indexOfColumn(names, dateColumn);
        if (dateIndex < 0) {
            throw new ExportWriter.ExportFailedException(
                    "Date column '" + dateColumn + "' is not part of the result " + names);
        }
        header = List.copyOf(names);
    }

    @Override
    public void batch(List<Object[]> rows) throws IOException {
        for (Object[] row : rows) {
            LocalDate date = ValueFormats.toDate(row[dateIndex]);
            if (date == null) {
                throw new ExportWriter.ExportFailedException(
                        "Row has no parsable date in column '" + dateColumn + "': " + row[dateIndex]);
            }
            YearMonth month = YearMonth.from(date);
            StagedCsvFile file = files.get(month);
            if (file == null) {
                file = writer.stage(dir.resolve(ExportWriter.monthlyFileName(baseName, month)), header);
                files.put(month, file);
            }
            file.printRow(row);
        }
    }

    @Override
    public List<Path> commit() throws IOException {
        List<Path> written = new ArrayList<>(files.size());
        for (StagedCsvFile file : files.values()) {
            written.add(file.commit());
        }
        return written;
    }

    @Override
    public void close() {
        files.values().forEach(StagedCsvFile::discard);
    }
}
