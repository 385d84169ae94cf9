package com.company.signalanalytics.query;

import lombok.Value;

import java.util.List;

/**
 * {@code column IN (SELECT ...)}, the semi-join form of a dimension join.
 */
@Value
public class SubqueryInPredicate implements Predicate {
    ColumnRef column;
    SelectQuery subquery;

    @Override
    public String render(List<Object> params) {
        return column.qualified() + " IN (" + subquery.render(params) + ")";
    }
}
