package com.kmg.exporter.model;

import java.util.Locale;

public enum AccumulationPolicy {
    ONCE,
    ACCUMULATE,
    MONTHLY;

    public boolean usesDateWindow() {
        return this != ONCE;
    }

    public static AccumulationPolicy parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Accumulation policy is required");
        }
        return AccumulationPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
