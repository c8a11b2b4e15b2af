package com.kmg.exporter.model;

public record GatingParameter(
        long id,
        String name,
        String query
) {
}
