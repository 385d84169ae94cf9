package com.company.signalanalytics.domain.enums;

public enum EntityStrategy {
    DIRECT_LIST,
    JOIN_PREDICATE,
    UNRESTRICTED
}
