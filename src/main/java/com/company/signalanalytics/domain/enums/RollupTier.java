package com.company.signalanalytics.domain.enums;

import com.company.signalanalytics.domain.TimeOfDayWindow;

import java.time.temporal.ChronoUnit;

/**
 * Physical storage tiers for travel-time facts.
 * RAW holds one row per segment per 15 minutes, the rollups hold pre-averaged
 * rows weighted by RECORD_COUNT.
 */
public enum RollupTier {
    RAW("TRAVEL_TIME_ANALYTICS", "TIMESTAMP", "TIME_15MIN",
            "TRAVEL_TIME_SECONDS", "PREDICTION", ChronoUnit.MINUTES),
    HOURLY("TRAVEL_TIME_HOURLY_AGG", "HOUR_START", "TIME_OF_DAY",
            "AVG_TRAVEL_TIME_SECONDS", "AVG_PREDICTION", ChronoUnit.HOURS),
    DAILY("TRAVEL_TIME_DAILY_AGG", "DATE_ONLY", null,
            "AVG_TRAVEL_TIME_SECONDS", "AVG_PREDICTION", ChronoUnit.DAYS);

    public static final String DATE_COLUMN = "DATE_ONLY";
    public static final String XD_COLUMN = "XD";

    private final String sourceTable;
    private final String timestampColumn;
    private final String timeOfDayColumn;  // null when the grain is a whole day
    private final String travelTimeColumn;
    private final String predictionColumn;
    private final ChronoUnit granularity;

    RollupTier(String sourceTable, String timestampColumn, String timeOfDayColumn,
               String travelTimeColumn, String predictionColumn, ChronoUnit granularity) {
        this.sourceTable = sourceTable;
        this.timestampColumn = timestampColumn;
        this.timeOfDayColumn = timeOfDayColumn;
        this.travelTimeColumn = travelTimeColumn;
        this.predictionColumn = predictionColumn;
        this.granularity = granularity;
    }

    public String getSourceTable() {
        return sourceTable;
    }

    public String getTimestampColumn() {
        return timestampColumn;
    }

    public String getTimeOfDayColumn() {
        return timeOfDayColumn;
    }

    public String getTravelTimeColumn() {
        return travelTimeColumn;
    }

    public String getPredictionColumn() {
        return predictionColumn;
    }

    public ChronoUnit getGranularity() {
        return granularity;
    }

    public boolean isRaw() {
        return this == RAW;
    }

    public boolean hasTimeOfDay() {
        return timeOfDayColumn != null;
    }

    /**
     * Whether a time-of-day window can be evaluated against this tier's
     * buckets without splitting one of them.
     */
    public boolean supports(TimeOfDayWindow window) {
        if (window == null || window.isFullDay()) {
            return true;
        }
        switch (this) {
            case RAW:
                return true;
            case HOURLY:
                return window.isHourAligned();
            default:
                return false;
        }
    }

    /**
     * Next finer tier, RAW is its own floor.
     */
    public RollupTier finer() {
        switch (this) {
            case DAILY:
                return HOURLY;
            default:
                return RAW;
        }
    }

    public String recordCountExpression(String alias) {
        return isRaw() ? "COUNT(*)" : "SUM(" + alias + ".RECORD_COUNT)";
    }

    /**
     * Mean of a per-row expression; rollup rows are weighted by the number
     * of raw records they stand for.
     */
    public String weightedAverage(String rowExpression, String alias) {
        if (isRaw()) {
            return "AVG(" + rowExpression + ")";
        }
        return "SUM((" + rowExpression + ") * " + alias + ".RECORD_COUNT) / NULLIF(SUM("
                + alias + ".RECORD_COUNT), 0)";
    }

    public String weightedSum(String rowExpression, String alias) {
        if (isRaw()) {
            return "SUM(" + rowExpression + ")";
        }
        return "SUM((" + rowExpression + ") * " + alias + ".RECORD_COUNT)";
    }

    public String anomalyCountExpression(String alias) {
        return isRaw()
                ? "COUNT(CASE WHEN " + alias + ".ANOMALY = TRUE THEN 1 END)"
                : "SUM(" + alias + ".ANOMALY_COUNT)";
    }

    public String pointSourceCountExpression(String alias) {
        return isRaw()
                ? "COUNT(CASE WHEN " + alias + ".ORIGINATED_ANOMALY = TRUE THEN 1 END)"
                : "SUM(" + alias + ".POINT_SOURCE_COUNT)";
    }
}
