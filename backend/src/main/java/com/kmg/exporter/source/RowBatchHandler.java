package com.kmg.exporter.source;

import java.io.IOException;
import java.util.List;

/**
 * Receives a streamed result: the column names once, then zero or more row batches.
 */
public interface RowBatchHandler {
    void columns(List<String> names) throws IOException;

    void batch(List<Object[]> rows) throws IOException;
}
