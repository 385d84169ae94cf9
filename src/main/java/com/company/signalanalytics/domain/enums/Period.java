package com.company.signalanalytics.domain.enums;

/**
 * Tag that discriminates the two windows of a before/after comparison.
 */
public enum Period {
    BEFORE("Before"),
    AFTER("After");

    private final String label;

    Period(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static Period fromLabel(String label) {
        for (Period period : values()) {
            if (period.label.equalsIgnoreCase(label)) {
                return period;
            }
        }
        throw new IllegalArgumentException("Unknown period: " + label);
    }
}
