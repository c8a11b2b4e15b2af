package com.kmg.exporter.export;

import com.kmg.exporter.model.AccumulationPolicy;
import com.kmg.exporter.model.DateWindow;
import com.kmg.exporter.model.JobDefinition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ExportWriterTest {

    @TempDir
    Path tempDir;

    private final ExportWriter writer = new ExportWriter(';');

    @Test
    void shouldWriteOnceExportWithHeaderAndSeparator() throws Exception {
        Path target = tempDir.resolve("out").resolve("customers.csv");

        List<Path> files = write(writer.openOnce(target), List.of("ID", "NAME", "BALANCE"),
                row(1, "Ana", new BigDecimal("10.50")),
                row(2, "Bruno; Jr", null));

        assertEquals(List.of(target), files);
        assertEquals(List.of("ID;NAME;BALANCE", "1;Ana;10.50", "2;\"Bruno; Jr\";"), lines(target));
    }

    @Test
    void shouldProduceIdenticalFileWhenOnceExportRunsTwice() throws Exception {
        Path target = tempDir.resolve("snapshot.csv");
        write(writer.openOnce(target), List.of("ID"), row(1), row(2));
        byte[] first = Files.readAllBytes(target);

        write(writer.openOnce(target), List.of("ID"), row(1), row(2));

        assertArrayEquals(first, Files.readAllBytes(target));
    }

    @Test
    void shouldReplaceWindowRowsAndKeepOlderHistoryOnAccumulate() throws Exception {
        Path target = tempDir.resolve("sales.csv");
        List<Object[]> history = new ArrayList<>();
        for (LocalDate day = LocalDate.of(2024, 1, 1); !day.isAfter(LocalDate.of(2024, 3, 31)); day = day.plusDays(1)) {
            history.add(row(java.sql.Date.valueOf(day), "old"));
        }
        write(writer.openOnce(target), List.of("SALE_DATE", "SOURCE"), history.toArray(new Object[0][]));

        JobDefinition job = job(AccumulationPolicy.ACCUMULATE, "SALE_DATE");
        DateWindow window = new DateWindow(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 15));
        write(writer.openSink(job, window), List.of("SALE_DATE", "SOURCE"),
                row(java.sql.Date.valueOf(LocalDate.of(2024, 3, 1)), "new"),
                row(java.sql.Date.valueOf(LocalDate.of(2024, 3, 15)), "new"));

        List<String> lines = lines(target);
        assertEquals("SALE_DATE;SOURCE", lines.get(0));
        List<String> data = lines.subList(1, lines.size());
        assertEquals(31 + 29 + 2, data.size());
        assertEquals("2024-01-01;old", data.get(0));
        assertEquals("2024-02-29;old", data.get(59));
        assertEquals(List.of("2024-03-01;new", "2024-03-15;new"), data.subList(60, 62));
        assertTrue(data.stream().noneMatch(line -> line.startsWith("2024-03") && line.endsWith("old")));
    }

    @Test
    void shouldCreateAccumulateFileWhenNoneExists() throws Exception {
        JobDefinition job = job(AccumulationPolicy.ACCUMULATE, "SALE_DATE");
        DateWindow window = new DateWindow(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 15));

        write(writer.openSink(job, window), List.of("SALE_DATE"), row(java.sql.Date.valueOf(LocalDate.of(2024, 3, 2))));

        assertEquals(List.of("SALE_DATE", "2024-03-02"), lines(tempDir.resolve("sales.csv")));
    }

    @Test
    void shouldMapHistoryColumnsByName() throws Exception {
        Path target = tempDir.resolve("sales.csv");
        Files.writeString(target, "SOURCE;SALE_DATE\nold;2024-02-10\n", StandardCharsets.UTF_8);

        JobDefinition job = job(AccumulationPolicy.ACCUMULATE, "SALE_DATE");
        write(writer.openSink(job, new DateWindow(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 5))),
                List.of("SALE_DATE", "SOURCE"),
                row("2024-03-02", "new"));

        assertEquals(List.of("SALE_DATE;SOURCE", "2024-02-10;old", "2024-03-02;new"), lines(target));
    }

    @Test
    void shouldSplitMonthlyExportByDateColumn() throws Exception {
        JobDefinition job = job(AccumulationPolicy.MONTHLY, "SALE_DATE");

        List<Path> files = write(writer.openSink(job, new DateWindow(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 3, 15))),
                List.of("ID", "SALE_DATE"),
                row(1, java.sql.Date.valueOf(LocalDate.of(2024, 2, 28))),
                row(2, java.sql.Date.valueOf(LocalDate.of(2024, 3, 1))),
                row(3, java.sql.Date.valueOf(LocalDate.of(2024, 2, 29))));

        Path february = tempDir.resolve("sales 02.2024.csv");
        Path march = tempDir.resolve("sales 03.2024.csv");
        assertEquals(List.of(february, march), files);
        assertEquals(List.of("ID;SALE_DATE", "1;2024-02-28", "3;2024-02-29"), lines(february));
        assertEquals(List.of("ID;SALE_DATE", "2;2024-03-01"), lines(march));
    }

    @Test
    void shouldProduceIdenticalMonthlyFilesWhenRunTwice() throws Exception {
        JobDefinition job = job(AccumulationPolicy.MONTHLY, "SALE_DATE");
        DateWindow window = new DateWindow(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 3, 15));
        Object[][] rows = {
                row(1, java.sql.Date.valueOf(LocalDate.of(2024, 2, 28)), new BigDecimal("10.50")),
                row(2, java.sql.Date.valueOf(LocalDate.of(2024, 3, 1)), new BigDecimal("3.00")),
                row(3, java.sql.Date.valueOf(LocalDate.of(2024, 2, 29)), null)
        };

        List<Path> firstRun = write(writer.openSink(job, window), List.of("ID", "SALE_DATE", "AMOUNT"), rows);
        byte[] february = Files.readAllBytes(tempDir.resolve("sales 02.2024.csv"));
        byte[] march = Files.readAllBytes(tempDir.resolve("sales 03.2024.csv"));

        List<Path> secondRun = write(writer.openSink(job, window), List.of("ID", "SALE_DATE", "AMOUNT"), rows);

        assertEquals(firstRun, secondRun);
        assertArrayEquals(february, Files.readAllBytes(tempDir.resolve("sales 02.2024.csv")));
        assertArrayEquals(march, Files.readAllBytes(tempDir.resolve("sales 03.2024.csv")));
        assertEquals(2, listFiles().size());
    }

    @Test
    void shouldWriteNoMonthlyFileForEmptyResult() throws Exception {
        JobDefinition job = job(AccumulationPolicy.MONTHLY, "SALE_DATE");

        List<Path> files = write(writer.openSink(job, new DateWindow(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 15))),
                List.of("ID", "SALE_DATE"));

        assertTrue(files.isEmpty());
        assertEquals(0, listFiles().size());
    }

    @Test
    void shouldLeaveNoPartialFileWhenExportFails() throws Exception {
        JobDefinition job = job(AccumulationPolicy.MONTHLY, "SALE_DATE");

        try (ExportSink sink = writer.openSink(job, new DateWindow(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 15)))) {
            sink.columns(List.of("ID", "SALE_DATE"));
            sink.batch(List.<Object[]>of(row(1, "2024-03-02")));
            assertThrows(ExportWriter.ExportFailedException.class, () -> sink.batch(List.<Object[]>of(row(2, null))));
        }

        assertEquals(0, listFiles().size());
    }

    @Test
    void shouldRequireDateColumnInResult() {
        JobDefinition job = job(AccumulationPolicy.MONTHLY, "SALE_DATE");
        ExportSink sink = writer.openSink(job, new DateWindow(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 15)));

        assertThrows(ExportWriter.ExportFailedException.class, () -> sink.columns(List.of("ID", "AMOUNT")));
    }

    @Test
    void shouldRequireDateColumnForWindowedPolicies() {
        JobDefinition job = job(AccumulationPolicy.MONTHLY, null);

        assertThrows(ExportWriter.ExportFailedException.class,
                () -> writer.openSink(job, new DateWindow(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 15))));
    }

    @Test
    void shouldNameMonthlyFilesWithMonthSuffix() {
        assertEquals("sales 01.2025.csv", ExportWriter.monthlyFileName("sales", YearMonth.of(2025, 1)));
    }

    private JobDefinition job(AccumulationPolicy policy, String dateColumn) {
        return new JobDefinition(7, "Sales", true, "SELECT 1 FROM DUAL", tempDir.toString(), "sales",
                policy, 0, null, null, dateColumn, null, null);
    }

    private static List<Path> write(ExportSink sink, List<String> columns, Object[]... rows) throws Exception {
        try (sink) {
            sink.columns(columns);
            if (rows.length > 0) {
                sink.batch(List.of(rows));
            }
            return sink.commit();
        }
    }

    private static Object[] row(Object... values) {
        return values;
    }

    private static List<String> lines(Path file) throws Exception {
        return Files.readAllLines(file, StandardCharsets.UTF_8);
    }

    private List<Path> listFiles() throws Exception {
        try (Stream<Path> files = Files.list(tempDir)) {
            return files.toList();
        }
    }
}
