package com.company.signalanalytics.domain.enums;

public enum ColumnType {
    INTEGER,
    DECIMAL,
    STRING,
    BOOLEAN,
    DATE,
    TIME,
    TIMESTAMP;

    public boolean isNumeric() {
        return this == INTEGER || this == DECIMAL;
    }
}
