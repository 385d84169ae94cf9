package com.company.signalanalytics.query;

import lombok.Value;

import java.util.List;

/**
 * Inclusive range; a null bound leaves that side open.
 */
@Value
public class RangePredicate implements Predicate {
    ColumnRef column;
    Object lower;
    Object upper;

    public static RangePredicate between(ColumnRef column, Object lower, Object upper) {
        return new RangePredicate(column, lower, upper);
    }

    @Override
    public String render(List<Object> params) {
        if (lower != null && upper != null) {
            params.add(lower);
            params.add(upper);
            return column.qualified() + " BETWEEN ? AND ?";
        }
        if (lower != null) {
            params.add(lower);
            return column.qualified() + " >= ?";
        }
        if (upper != null) {
            params.add(upper);
            return column.qualified() + " <= ?";
        }
        return AndPredicate.TRUE_SQL;
    }
}
