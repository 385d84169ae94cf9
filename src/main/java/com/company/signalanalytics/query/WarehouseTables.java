package com.company.signalanalytics.query;

/**
 * Physical names of the dimension and reference tables and the aliases
 * the query builders agree on.
 */
public final class WarehouseTables {

    public static final String DIM_SIGNALS_XD = "DIM_SIGNALS_XD";
    public static final String DIM_SIGNALS = "DIM_SIGNALS";
    public static final String DIM_DATE = "DIM_DATE";
    public static final String FREEFLOW = "FREEFLOW";
    public static final String XD_GEOM = "XD_GEOM";
    public static final String CHANGEPOINTS = "CHANGEPOINTS";

    public static final String FACT_ALIAS = "t";
    public static final String DIMENSION_ALIAS = "xd";
    public static final String SIGNAL_ALIAS = "s";
    public static final String CALENDAR_ALIAS = "dd";
    public static final String FREEFLOW_ALIAS = "f";
    public static final String LEGEND_ALIAS = "legend_xd";
    public static final String KEY_ALIAS = "k";
    public static final String KEY_SIGNAL_ALIAS = "ks";

    private WarehouseTables() {
    }
}
