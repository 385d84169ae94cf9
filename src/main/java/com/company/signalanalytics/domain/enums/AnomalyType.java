package com.company.signalanalytics.domain.enums;

public enum AnomalyType {
    ALL("ANOMALY", "ANOMALY_COUNT"),
    POINT_SOURCE("ORIGINATED_ANOMALY", "POINT_SOURCE_COUNT");

    private final String rawFlagColumn;
    private final String rollupCountColumn;

    AnomalyType(String rawFlagColumn, String rollupCountColumn) {
        this.rawFlagColumn = rawFlagColumn;
        this.rollupCountColumn = rollupCountColumn;
    }

    public String getRawFlagColumn() {
        return rawFlagColumn;
    }

    public String getRollupCountColumn() {
        return rollupCountColumn;
    }
}
