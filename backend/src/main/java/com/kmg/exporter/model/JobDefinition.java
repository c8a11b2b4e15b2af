package com.kmg.exporter.model;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.OffsetDateTime;

public record JobDefinition(
        long id,
        String name,
        boolean active,
        String query,
        String exportPath,
        String exportName,
        AccumulationPolicy policy,
        int daysOffset,
        Long gatingParameterId,
        String primaryKeyColumn,
        String dateColumn,
        OffsetDateTime lastExecution,
        LocalDate lastProcessedDate
) {
    public boolean gated() {
        return gatingParameterId != null;
    }

    public Path exportDir() {
        return Path.of(exportPath);
    }

    public String label() {
        return name + " (#" + id + ")";
    }
}
