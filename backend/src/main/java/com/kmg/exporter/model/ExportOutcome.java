package com.kmg.exporter.model;

import java.nio.file.Path;
import java.util.List;

public record ExportOutcome(long rows, List<Path> files) {
}
