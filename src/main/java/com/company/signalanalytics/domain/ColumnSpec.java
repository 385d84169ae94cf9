package com.company.signalanalytics.domain;

import com.company.signalanalytics.domain.enums.ColumnType;
import lombok.Value;

@Value
public class ColumnSpec {
    String name;
    ColumnType type;
    boolean nullable;

    public static ColumnSpec nonNull(String name, ColumnType type) {
        return new ColumnSpec(name, type, false);
    }

    public static ColumnSpec nullable(String name, ColumnType type) {
        return new ColumnSpec(name, type, true);
    }
}
