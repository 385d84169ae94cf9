package com.company.signalanalytics.query;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Single SELECT block. Select and grouping expressions are assembled from
 * enum-backed identifiers only; every user value travels as a bound parameter
 * through {@link #where}.
 */
@Value
@Builder(toBuilder = true)
public class SelectQuery implements Statement {

    @Singular
    List<String> columns;

    String fromTable;
    String fromAlias;

    @Singular
    List<Join> joins;

    Predicate where;

    @Singular("groupBy")
    List<String> groupings;

    // filter on window functions, evaluated after grouping
    String qualify;

    @Singular("orderBy")
    List<String> orderings;

    Integer limit;

    boolean distinct;

    @Override
    public String render(List<Object> params) {
        StringBuilder sql = new StringBuilder("SELECT ");
        if (distinct) {
            sql.append("DISTINCT ");
        }
        sql.append(String.join(", ", columns));
        sql.append("\nFROM ").append(ColumnRef.requireIdentifier(fromTable))
                .append(' ').append(ColumnRef.requireIdentifier(fromAlias));

        Set<Join> uniqueJoins = new LinkedHashSet<>(joins);
        for (Join join : uniqueJoins) {
            sql.append('\n').append(join.render());
        }

        if (where != null && !(where instanceof AndPredicate && ((AndPredicate) where).isEmpty())) {
            sql.append("\nWHERE ").append(where.render(params));
        }
        if (!groupings.isEmpty()) {
            sql.append("\nGROUP BY ").append(String.join(", ", groupings));
        }
        if (qualify != null) {
            sql.append("\nQUALIFY ").append(qualify);
        }
        if (!orderings.isEmpty()) {
            sql.append("\nORDER BY ").append(String.join(", ", orderings));
        }
        if (limit != null) {
            sql.append("\nLIMIT ").append(limit.intValue());
        }
        return sql.toString();
    }
}
