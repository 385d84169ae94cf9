package com.company.signalanalytics.query;

import lombok.Value;

import java.util.List;

@Value
public class NotNullPredicate implements Predicate {
    ColumnRef column;

    public static NotNullPredicate notNull(ColumnRef column) {
        return new NotNullPredicate(column);
    }

    @Override
    public String render(List<Object> params) {
        return column.qualified() + " IS NOT NULL";
    }
}
