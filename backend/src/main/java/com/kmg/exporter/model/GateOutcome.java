package com.kmg.exporter.model;

public enum GateOutcome {
    READY,
    PENDING,
    ERROR
}
