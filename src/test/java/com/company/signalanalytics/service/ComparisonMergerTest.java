package com.company.signalanalytics.service;

import com.company.signalanalytics.domain.ColumnSpec;
import com.company.signalanalytics.domain.Table;
import com.company.signalanalytics.domain.enums.ColumnType;
import com.company.signalanalytics.domain.enums.ComparisonMetric;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ComparisonMergerTest {

    private static final List<ColumnSpec> PERIOD_COLUMNS = List.of(
            ColumnSpec.nonNull("PERIOD", ColumnType.STRING),
            ColumnSpec.nonNull("XD", ColumnType.INTEGER),
            ColumnSpec.nullable("VALUE", ColumnType.DECIMAL));

    private final ComparisonMerger merger = new ComparisonMerger();

    @Test
    void shouldComputeDeltaAsAfterMinusBefore() {
        Table rows = periodRows(
                row("Before", 42L, 10.0),
                row("After", 42L, 15.0));

        Table merged = merger.merge(rows, "XD", ComparisonMetric.AVG_TRAVEL_TIME);

        assertEquals(List.of("XD", "AVG_TRAVEL_TIME_BEFORE", "AVG_TRAVEL_TIME_AFTER", "AVG_TRAVEL_TIME_DIFF"),
                merged.columnNames());
        assertEquals(1, merged.rowCount());
        Map<String, Object> entity = merged.getRows().get(0);
        assertEquals(42L, entity.get("XD"));
        assertEquals(10.0, (double) entity.get("AVG_TRAVEL_TIME_BEFORE"), 1e-9);
        assertEquals(15.0, (double) entity.get("AVG_TRAVEL_TIME_AFTER"), 1e-9);
        assertEquals(5.0, (double) entity.get("AVG_TRAVEL_TIME_DIFF"), 1e-9);
    }

    @Test
    void shouldYieldZeroDeltaForIdenticalWindows() {
        List<Map<String, Object>> input = new ArrayList<>();
        for (long xd = 1; xd <= 5; xd++) {
            input.add(row("Before", xd, 1.0 + xd / 3.0));
            input.add(row("After", xd, 1.0 + xd / 3.0));
        }

        Table merged = merger.merge(new Table(PERIOD_COLUMNS, input), "XD", ComparisonMetric.TRAVEL_TIME_INDEX);

        assertEquals(5, merged.rowCount());
        for (Map<String, Object> entity : merged.getRows()) {
            assertEquals(0.0, (double) entity.get("TTI_DIFF"), 0.0);
        }
    }

    @Test
    void shouldCountMissingSideAsZero() {
        Table rows = periodRows(
                row("Before", 1L, 1.5),
                row("After", 2L, 1.2));

        Table merged = merger.merge(rows, "XD", ComparisonMetric.TRAVEL_TIME_INDEX);

        assertEquals(2, merged.rowCount());
        Map<String, Object> onlyBefore = merged.getRows().get(0);
        assertEquals(0.0, (double) onlyBefore.get("TTI_AFTER"), 0.0);
        assertEquals(-1.5, (double) onlyBefore.get("TTI_DIFF"), 1e-9);
        Map<String, Object> onlyAfter = merged.getRows().get(1);
        assertEquals(0.0, (double) onlyAfter.get("TTI_BEFORE"), 0.0);
        assertEquals(1.2, (double) onlyAfter.get("TTI_DIFF"), 1e-9);
    }

    @Test
    void shouldPairKeysAcrossNumericTypes() {
        Table rows = periodRows(
                row("Before", new BigDecimal("7"), 2.0),
                row("After", 7L, 2.5));

        Table merged = merger.merge(rows, "XD", ComparisonMetric.TRAVEL_TIME_INDEX);

        assertEquals(1, merged.rowCount());
        assertEquals(0.5, (double) merged.getRows().get(0).get("TTI_DIFF"), 1e-9);
    }

    @Test
    void shouldTreatNullValueAsZero() {
        Table rows = periodRows(
                row("Before", 3L, null),
                row("After", 3L, 4.0));

        Table merged = merger.merge(rows, "XD", ComparisonMetric.TRAVEL_TIME_INDEX);

        assertEquals(4.0, (double) merged.getRows().get(0).get("TTI_DIFF"), 1e-9);
    }

    @Test
    void shouldRejectUnknownPeriodLabel() {
        Table rows = periodRows(row("During", 3L, 1.0));

        assertThrows(IllegalArgumentException.class,
                () -> merger.merge(rows, "XD", ComparisonMetric.TRAVEL_TIME_INDEX));
    }

    @SafeVarargs
    private static Table periodRows(Map<String, Object>... rows) {
        return new Table(PERIOD_COLUMNS, List.of(rows));
    }

    private static Map<String, Object> row(String period, Object xd, Double value) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("PERIOD", period);
        row.put("XD", xd);
        row.put("VALUE", value);
        return row;
    }
}
