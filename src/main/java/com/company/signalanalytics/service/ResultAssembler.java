package com.company.signalanalytics.service;

import com.company.signalanalytics.domain.ColumnSpec;
import com.company.signalanalytics.domain.Table;
import com.company.signalanalytics.domain.enums.ColumnType;
import com.company.signalanalytics.util.RowValues;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Left-joins fact aggregates onto the dimension universe in-process.
 * Every dimension row survives; an entity without facts gets zeros, never
 * nulls, in the aggregate columns.
 */
@Component
@Slf4j
public class ResultAssembler {

    public Table assemble(Table dimensionRows,
                          Map<String, Map<String, Object>> aggregateRowsByKey,
                          String joinKey,
                          List<ColumnSpec> aggregateColumns) {

        List<ColumnSpec> columns = new ArrayList<>(dimensionRows.getColumns());
        for (ColumnSpec aggregate : aggregateColumns) {
            if (!aggregate.getType().isNumeric()) {
                throw new IllegalArgumentException("Aggregate column " + aggregate.getName() + " is not numeric");
            }
            columns.add(ColumnSpec.nonNull(aggregate.getName(), aggregate.getType()));
        }

        int matched = 0;
        List<Map<String, Object>> rows = new ArrayList<>(dimensionRows.rowCount());
        for (Map<String, Object> dimension : dimensionRows.getRows()) {
            Map<String, Object> aggregate = aggregateRowsByKey.get(RowValues.joinKey(dimension.get(joinKey)));
            if (aggregate != null) {
                matched++;
            }
            Map<String, Object> row = new LinkedHashMap<>(dimension);
            for (ColumnSpec column : aggregateColumns) {
                Object value = aggregate == null ? null : aggregate.get(column.getName());
                row.put(column.getName(), value == null ? zero(column.getType()) : value);
            }
            rows.add(row);
        }

        log.debug("Assembled {} dimension rows, {} with aggregates", rows.size(), matched);
        return new Table(columns, rows);
    }

    /**
     * Attaches dimension attributes to fact rows by key. Every fact row
     * survives; attributes of an unknown key stay null.
     */
    public Table enrich(Table factRows,
                        Map<String, Map<String, Object>> attributeRowsByKey,
                        String joinKey,
                        List<ColumnSpec> attributeColumns) {

        List<ColumnSpec> columns = new ArrayList<>(factRows.getColumns());
        for (ColumnSpec attribute : attributeColumns) {
            columns.add(ColumnSpec.nullable(attribute.getName(), attribute.getType()));
        }

        int unmatched = 0;
        List<Map<String, Object>> rows = new ArrayList<>(factRows.rowCount());
        for (Map<String, Object> fact : factRows.getRows()) {
            Map<String, Object> attributes = attributeRowsByKey.get(RowValues.joinKey(fact.get(joinKey)));
            if (attributes == null) {
                unmatched++;
            }
            Map<String, Object> row = new LinkedHashMap<>(fact);
            for (ColumnSpec column : attributeColumns) {
                row.put(column.getName(), attributes == null ? null : attributes.get(column.getName()));
            }
            rows.add(row);
        }

        if (unmatched > 0) {
            log.debug("{} of {} fact rows have no dimension attributes", unmatched, rows.size());
        }
        return new Table(columns, rows);
    }

    /**
     * Indexes rows by the normalized value of their key column. A later row
     * replaces an earlier one with the same key.
     */
    public Map<String, Map<String, Object>> indexByKey(Table aggregates, String keyColumn) {
        Map<String, Map<String, Object>> index = new HashMap<>(aggregates.rowCount() * 2);
        for (Map<String, Object> row : aggregates.getRows()) {
            String key = RowValues.joinKey(row.get(keyColumn));
            if (key != null) {
                index.put(key, row);
            }
        }
        return index;
    }

    /**
     * Like {@link #indexByKey}, with one more column on each indexed row
     * listing the distinct member values seen under its key, sorted and
     * comma separated.
     */
    public Map<String, Map<String, Object>> indexWithMembers(Table rows, String keyColumn,
                                                              String memberColumn, String membersColumn) {
        Map<String, Map<String, Object>> index = indexByKey(rows, keyColumn);
        Map<String, Set<String>> members = new HashMap<>(index.size() * 2);
        for (Map<String, Object> row : rows.getRows()) {
            String key = RowValues.joinKey(row.get(keyColumn));
            String member = RowValues.asString(row.get(memberColumn));
            if (key != null && member != null) {
                members.computeIfAbsent(key, k -> new TreeSet<>()).add(member);
            }
        }

        Map<String, Map<String, Object>> withMembers = new HashMap<>(index.size() * 2);
        index.forEach((key, row) -> {
            Map<String, Object> extended = new LinkedHashMap<>(row);
            extended.put(membersColumn, String.join(", ", members.getOrDefault(key, Set.of())));
            withMembers.put(key, extended);
        });
        return withMembers;
    }

    static Object zero(ColumnType type) {
        return type == ColumnType.INTEGER ? (Object) 0L : (Object) 0.0d;
    }
}
