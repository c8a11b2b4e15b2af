package com.kmg.exporter.export;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Replaces the destination with the full result.
 */
class OnceExportSink implements ExportSink {
    private final ExportWriter writer;
    private final Path target;
    private StagedCsvFile staged;

    OnceExportSink(ExportWriter writer, Path target) {
        this.writer = writer;
        this.target = target;
    }

    @Override
    public void columns(List<String> names) throws IOException {
        staged = writer.stage(target, names);
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
