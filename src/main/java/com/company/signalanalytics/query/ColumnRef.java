package com.company.signalanalytics.query;

import lombok.Value;

import java.util.regex.Pattern;

/**
 * Alias-qualified column reference. Identifiers are checked on construction
 * so that only plain names ever reach the query text.
 */
@Value
public class ColumnRef {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    String alias;
    String column;

    public ColumnRef(String alias, String column) {
        this.alias = requireIdentifier(alias);
        this.column = requireIdentifier(column);
    }

    public static ColumnRef of(String alias, String column) {
        return new ColumnRef(alias, column);
    }

    public String qualified() {
        return alias + "." + column;
    }

    static String requireIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Illegal SQL identifier: " + name);
        }
        return name;
    }

    @Override
    public String toString() {
        return qualified();
    }
}
