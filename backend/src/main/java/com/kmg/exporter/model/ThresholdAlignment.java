package com.kmg.exporter.model;

/**
 * How the gate threshold is derived from {@code today - daysOffset}.
 */
public enum ThresholdAlignment {
    /** Every unit must have advanced to the reference day itself. */
    DAY,
    /** Every unit must have closed the month before the reference day's month. */
    END_OF_MONTH
}
