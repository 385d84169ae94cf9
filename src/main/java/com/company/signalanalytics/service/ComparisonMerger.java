package com.company.signalanalytics.service;

import com.company.signalanalytics.domain.ColumnSpec;
import com.company.signalanalytics.domain.Table;
import com.company.signalanalytics.domain.enums.ColumnType;
import com.company.signalanalytics.domain.enums.ComparisonMetric;
import com.company.signalanalytics.domain.enums.Period;
import com.company.signalanalytics.query.ComparisonQuery;
import com.company.signalanalytics.query.ComparisonQueryBuilder;
import com.company.signalanalytics.util.RowValues;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Full outer join of period-tagged summary rows by entity key. A side with
 * no value counts as 0, and the delta is after minus before.
 */
@Component
public class ComparisonMerger {

    public Table merge(Table periodRows, ComparisonQuery query) {
        return merge(periodRows, query.keyColumn(), query.getMetric());
    }

    public Table merge(Table periodRows, String keyColumn, ComparisonMetric metric) {
        Map<String, Object> keys = new LinkedHashMap<>();
        Map<String, Double> before = new LinkedHashMap<>();
        Map<String, Double> after = new LinkedHashMap<>();

        for (Map<String, Object> row : periodRows.getRows()) {
            Object key = row.get(keyColumn);
            String normalized = RowValues.joinKey(key);
            if (normalized == null) {
                continue;
            }
            keys.putIfAbsent(normalized, key);
            Double value = RowValues.asDouble(row.get(ComparisonQueryBuilder.VALUE_COLUMN));
            Period period = Period.fromLabel(String.valueOf(row.get(ComparisonQueryBuilder.PERIOD_COLUMN)));
            (period == Period.BEFORE ? before : after).put(normalized, value == null ? 0.0d : value);
        }

        ColumnType keyType = periodRows.column(keyColumn).map(ColumnSpec::getType).orElse(ColumnType.STRING);
        List<ColumnSpec> columns = List.of(
                ColumnSpec.nonNull(keyColumn, keyType),
                ColumnSpec.nonNull(metric.beforeColumn(), ColumnType.DECIMAL),
                ColumnSpec.nonNull(metric.afterColumn(), ColumnType.DECIMAL),
                ColumnSpec.nonNull(metric.diffColumn(), ColumnType.DECIMAL));

        List<Map<String, Object>> rows = new ArrayList<>(keys.size());
        keys.forEach((normalized, key) -> {
            double b = before.getOrDefault(normalized, 0.0d);
            double a = after.getOrDefault(normalized, 0.0d);
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(keyColumn, key);
            row.put(metric.beforeColumn(), b);
            row.put(metric.afterColumn(), a);
            row.put(metric.diffColumn(), a - b);
            rows.add(row);
        });
        return new Table(columns, rows);
    }
}
