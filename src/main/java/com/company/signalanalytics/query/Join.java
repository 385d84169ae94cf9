package com.company.signalanalytics.query;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Join of a table under an alias. Two joins with the same alias are the same
 * join, which lets fragments share a join without emitting it twice.
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Join {

    private final String table;

    @EqualsAndHashCode.Include
    private final String alias;

    private final ColumnRef left;
    private final ColumnRef right;

    private final boolean outer;

    public Join(String table, String alias, ColumnRef left, ColumnRef right) {
        this(table, alias, left, right, false);
    }

    private Join(String table, String alias, ColumnRef left, ColumnRef right, boolean outer) {
        this.table = ColumnRef.requireIdentifier(table);
        this.alias = ColumnRef.requireIdentifier(alias);
        this.left = left;
        this.right = right;
        this.outer = outer;
    }

    public static Join inner(String table, String alias, ColumnRef left, ColumnRef right) {
        return new Join(table, alias, left, right, false);
    }

    /**
     * Keeps rows without a match, with nulls in the joined columns.
     */
    public static Join leftOuter(String table, String alias, ColumnRef left, ColumnRef right) {
        return new Join(table, alias, left, right, true);
    }

    public String render() {
        return (outer ? "LEFT JOIN " : "JOIN ") + table + " " + alias
                + " ON " + left.qualified() + " = " + right.qualified();
    }

    @Override
    public String toString() {
        return render();
    }
}
