package com.company.signalanalytics.domain.enums;

public enum ChangepointSort {
    TIMESTAMP("TIMESTAMP"),
    PCT_CHANGE("PCT_CHANGE"),
    AVG_DIFF("AVG_DIFF"),
    SCORE("SCORE");

    private final String column;

    ChangepointSort(String column) {
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
