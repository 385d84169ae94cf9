package com.company.signalanalytics.domain.enums;

/**
 * Dimension attributes a chart legend may group by.
 * XD is the segment's own identifier, the rest are descriptive attributes.
 */
public enum LegendField {
    XD(true),
    ID(false),
    BEARING(false),
    COUNTY(false),
    ROADNAME(false);

    private final boolean entityIdentifier;

    LegendField(boolean entityIdentifier) {
        this.entityIdentifier = entityIdentifier;
    }

    public boolean isEntityIdentifier() {
        return entityIdentifier;
    }

    public String getColumn() {
        return name();
    }
}
