package com.company.signalanalytics.domain.enums;

/**
 * X axis of a time-indexed series.
 */
public enum TimeAxis {
    TIMESTAMP,
    TIME_OF_DAY
}
