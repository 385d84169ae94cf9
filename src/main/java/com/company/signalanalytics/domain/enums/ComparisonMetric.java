package com.company.signalanalytics.domain.enums;

/**
 * Per-entity aggregate compared across the before and after windows.
 */
public enum ComparisonMetric {
    TRAVEL_TIME_INDEX("TTI", true),
    AVG_TRAVEL_TIME("AVG_TRAVEL_TIME", false);

    public static final String FREEFLOW_TABLE = "FREEFLOW";
    public static final String FREEFLOW_COLUMN = "TRAVEL_TIME_SECONDS";

    private final String columnPrefix;
    private final boolean freeflowRequired;

    ComparisonMetric(String columnPrefix, boolean freeflowRequired) {
        this.columnPrefix = columnPrefix;
        this.freeflowRequired = freeflowRequired;
    }

    public String getColumnPrefix() {
        return columnPrefix;
    }

    public boolean isFreeflowRequired() {
        return freeflowRequired;
    }

    public String expression(RollupTier tier, String factAlias, String freeflowAlias) {
        String actual = factAlias + "." + tier.getTravelTimeColumn();
        if (freeflowRequired) {
            return tier.weightedAverage(actual + " / " + freeflowAlias + "." + FREEFLOW_COLUMN, factAlias);
        }
        return tier.weightedAverage(actual, factAlias);
    }

    public String beforeColumn() {
        return columnPrefix + "_BEFORE";
    }

    public String afterColumn() {
        return columnPrefix + "_AFTER";
    }

    public String diffColumn() {
        return columnPrefix + "_DIFF";
    }
}
