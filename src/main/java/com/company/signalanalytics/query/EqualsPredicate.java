package com.company.signalanalytics.query;

import lombok.Value;

import java.util.List;

@Value
public class EqualsPredicate implements Predicate {
    ColumnRef column;
    Object value;

    public static EqualsPredicate eq(ColumnRef column, Object value) {
        return new EqualsPredicate(column, value);
    }

    @Override
    public String render(List<Object> params) {
        params.add(value);
        return column.qualified() + " = ?";
    }
}
