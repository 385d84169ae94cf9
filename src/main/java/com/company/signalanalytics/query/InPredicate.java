package com.company.signalanalytics.query;

import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * Set membership. An empty value set matches nothing.
 */
@Value
public class InPredicate implements Predicate {
    ColumnRef column;
    List<?> values;

    public static InPredicate in(ColumnRef column, List<?> values) {
        return new InPredicate(column, values);
    }

    @Override
    public String render(List<Object> params) {
        if (values.isEmpty()) {
            return "1 = 0";
        }
        params.addAll(values);
        return column.qualified() + " IN (" + String.join(", ", Collections.nCopies(values.size(), "?")) + ")";
    }
}
