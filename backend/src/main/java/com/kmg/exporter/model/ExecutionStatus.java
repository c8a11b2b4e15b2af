package com.kmg.exporter.model;

public enum ExecutionStatus {
    COMPLETED,
    FAILED,
    SKIPPED
}
