package com.kmg.exporter.model;

import java.time.LocalDate;
import java.util.List;

public record GateDecision(
        GateOutcome outcome,
        LocalDate threshold,
        List<String> openUnits,
        String error
) {
    public static GateDecision ungated() {
        return new GateDecision(GateOutcome.READY, null, List.of(), null);
    }

    public static GateDecision ready(LocalDate threshold) {
        return new GateDecision(GateOutcome.READY, threshold, List.of(), null);
    }

    public static GateDecision pending(LocalDate threshold, List<String> openUnits) {
        return new GateDecision(GateOutcome.PENDING, threshold, List.copyOf(openUnits), null);
    }

    public static GateDecision error(String error) {
        return new GateDecision(GateOutcome.ERROR, null, List.of(), error);
    }
}
