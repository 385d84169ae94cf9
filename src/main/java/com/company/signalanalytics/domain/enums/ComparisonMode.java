package com.company.signalanalytics.domain.enums;

public enum ComparisonMode {
    SUMMARY,
    SERIES
}
