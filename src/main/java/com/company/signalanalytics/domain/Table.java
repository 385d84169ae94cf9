package com.company.signalanalytics.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Uniform tabular result handed to the serialization layer: named, typed
 * columns with explicit nullability and rows keyed by column name.
 */
@Getter
@EqualsAndHashCode
public class Table {

    private final List<ColumnSpec> columns;
    private final List<Map<String, Object>> rows;

    public Table(List<ColumnSpec> columns, List<Map<String, Object>> rows) {
        this.columns = List.copyOf(columns);
        List<Map<String, Object>> copied = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            copied.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        this.rows = Collections.unmodifiableList(copied);
    }

    public static Table empty(List<ColumnSpec> columns) {
        return new Table(columns, List.of());
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public Optional<ColumnSpec> column(String name) {
        return columns.stream()
                .filter(c -> c.getName().equalsIgnoreCase(name))
                .findFirst();
    }

    public List<String> columnNames() {
        List<String> names = new ArrayList<>(columns.size());
        columns.forEach(c -> names.add(c.getName()));
        return names;
    }

    public List<Object> values(String columnName) {
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(row.get(columnName));
        }
        return values;
    }

    @Override
    public String toString() {
        return "Table{columns=" + columnNames() + ", rows=" + rows.size() + "}";
    }
}
