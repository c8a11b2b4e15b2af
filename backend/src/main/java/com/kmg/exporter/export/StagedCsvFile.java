package com.kmg.exporter.export;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * A CSV file written next to its destination under a temporary name and moved into place on commit.
 */
class StagedCsvFile {
    private static final Logger log = LoggerFactory.getLogger(StagedCsvFile.class);

    private final Path target;
    private final Path temp;
    private final CSVPrinter printer;
    private boolean finished;

    StagedCsvFile(Path target, CSVFormat format, List<String> header) throws IOException {
        this.target = target.toAbsolutePath().normalize();
        Path dir = this.target.getParent();
        Files.createDirectories(dir);
        this.temp = Files.createTempFile(dir, "." + this.target.getFileName() + ".", ".tmp");
        BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8);
        this.printer = new CSVPrinter(writer, format);
        printer.printRecord(header);
    }

    Path target() {
        return target;
    }

    void printRow(Object[] row) throws IOException {
        List<String> values = new ArrayList<>(row.length);
        for (Object value : row) {
            values.add(ValueFormats.format(value));
        }
        printer.printRecord(values);
    }

    void printValues(List<String> values) throws IOException {
        printer.printRecord(values);
    }

    Path commit() throws IOException {
        printer.close(true);
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
        finished = true;
        return target;
    }

    void discard() {
        if (finished) {
            return;
        }
        finished = true;
        try {
            printer.close(false);
        } catch (IOException e) {
            log.debug("Failed to close staged file {}: {}", temp, e.getMessage());
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to delete staged file {}: {}", temp, e.getMessage());
        }
    }
}
