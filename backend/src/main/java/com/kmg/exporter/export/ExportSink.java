package com.kmg.exporter.export;

import com.kmg.exporter.source.RowBatchHandler;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Destination of one export run. Rows are staged in temporary files; {@link #commit()} moves them
 * over their destinations and {@link #close()} removes whatever was not committed.
 */
public interface ExportSink extends RowBatchHandler, AutoCloseable {
    List<Path> commit() throws IOException;

    @Override
    void close();
}
