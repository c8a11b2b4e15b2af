package com.kmg.exporter.model;

public enum EventLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR
}
