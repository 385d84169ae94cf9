package com.company.signalanalytics.domain.enums;

/**
 * Level at which before/after comparisons are keyed.
 */
public enum EntityKey {
    SIGNAL("ID"),
    XD("XD");

    private final String column;

    EntityKey(String column) {
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
