package com.company.signalanalytics.query;

public enum FragmentKind {
    DATE_RANGE,
    TIME_OF_DAY,
    DAY_OF_WEEK,
    ENTITY,
    ANOMALY_EXCLUSION,
    LEGEND,
    CHANGE_THRESHOLD,
    SELECTION
}
