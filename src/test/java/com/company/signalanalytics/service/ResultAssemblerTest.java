package com.company.signalanalytics.service;

import com.company.signalanalytics.domain.ColumnSpec;
import com.company.signalanalytics.domain.Table;
import com.company.signalanalytics.domain.enums.ColumnType;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResultAssemblerTest {

    private static final List<ColumnSpec> DIMENSION_COLUMNS = List.of(
            ColumnSpec.nonNull("ID", ColumnType.STRING),
            ColumnSpec.nonNull("XD", ColumnType.INTEGER),
            ColumnSpec.nullable("ROADNAME", ColumnType.STRING));

    private static final List<ColumnSpec> AGGREGATE_COLUMNS = List.of(
            ColumnSpec.nonNull("AVG_TRAVEL_TIME", ColumnType.DECIMAL),
            ColumnSpec.nonNull("RECORD_COUNT", ColumnType.INTEGER));

    private final ResultAssembler assembler = new ResultAssembler();

    @Test
    void shouldKeepEveryDimensionRowAndZeroMissingAggregates() {
        Table dimensions = dimensions(50);
        List<Map<String, Object>> aggregates = new ArrayList<>();
        for (long xd = 1; xd <= 12; xd++) {
            aggregates.add(aggregate(BigDecimal.valueOf(xd), 30.0 + xd, 96L));
        }
        Table aggregateTable = new Table(List.of(ColumnSpec.nonNull("XD", ColumnType.INTEGER)), aggregates);

        Table assembled = assembler.assemble(dimensions, assembler.indexByKey(aggregateTable, "XD"),
                "XD", AGGREGATE_COLUMNS);

        assertEquals(50, assembled.rowCount());
        long zeroed = assembled.getRows().stream()
                .filter(row -> Long.valueOf(0L).equals(row.get("RECORD_COUNT")))
                .count();
        assertEquals(38, zeroed);
        assertEquals(31.0, assembled.getRows().get(0).get("AVG_TRAVEL_TIME"));
        assertEquals(0.0d, assembled.getRows().get(49).get("AVG_TRAVEL_TIME"));
        assertEquals(List.of("ID", "XD", "ROADNAME", "AVG_TRAVEL_TIME", "RECORD_COUNT"), assembled.columnNames());
    }

    @Test
    void shouldZeroEveryRowWhenThereAreNoAggregates() {
        Table assembled = assembler.assemble(dimensions(50), Map.of(), "XD", AGGREGATE_COLUMNS);

        assertEquals(50, assembled.rowCount());
        assembled.getRows().forEach(row -> {
            assertEquals(0L, row.get("RECORD_COUNT"));
            assertEquals(0.0d, row.get("AVG_TRAVEL_TIME"));
        });
    }

    @Test
    void shouldRepeatAggregatesForSegmentSharedBySignals() {
        List<Map<String, Object>> rows = List.of(dimension("S1", 9L), dimension("S2", 9L));
        Table aggregates = new Table(List.of(), List.of(aggregate(9L, 44.0, 4L)));

        Table assembled = assembler.assemble(new Table(DIMENSION_COLUMNS, rows),
                assembler.indexByKey(aggregates, "XD"), "XD", AGGREGATE_COLUMNS);

        assertEquals(2, assembled.rowCount());
        assertEquals(4L, assembled.getRows().get(0).get("RECORD_COUNT"));
        assertEquals(4L, assembled.getRows().get(1).get("RECORD_COUNT"));
    }

    @Test
    void shouldDeclareAggregateColumnsNonNullable() {
        Table assembled = assembler.assemble(dimensions(1), Map.of(), "XD", AGGREGATE_COLUMNS);

        assertFalse(assembled.column("AVG_TRAVEL_TIME").orElseThrow().isNullable());
    }

    @Test
    void shouldRejectNonNumericAggregateColumn() {
        List<ColumnSpec> columns = List.of(ColumnSpec.nonNull("LABEL", ColumnType.STRING));

        assertThrows(IllegalArgumentException.class,
                () -> assembler.assemble(dimensions(1), Map.of(), "XD", columns));
    }

    @Test
    void shouldTagFactRowsWithLastDimensionRowOfTheirSegment() {
        Table dimensions = new Table(DIMENSION_COLUMNS, List.of(dimension("S1", 9L), dimension("S2", 9L)));
        Map<String, Object> known = new LinkedHashMap<>();
        known.put("XD", new BigDecimal("9"));
        known.put("TRAVEL_TIME_SECONDS", 41.5);
        Map<String, Object> unknown = new LinkedHashMap<>();
        unknown.put("XD", 12L);
        unknown.put("TRAVEL_TIME_SECONDS", 20.0);
        Table facts = new Table(List.of(
                ColumnSpec.nonNull("XD", ColumnType.INTEGER),
                ColumnSpec.nullable("TRAVEL_TIME_SECONDS", ColumnType.DECIMAL)), List.of(known, unknown));

        Table enriched = assembler.enrich(facts, assembler.indexByKey(dimensions, "XD"), "XD",
                List.of(ColumnSpec.nonNull("ID", ColumnType.STRING)));

        assertEquals(List.of("XD", "TRAVEL_TIME_SECONDS", "ID"), enriched.columnNames());
        assertTrue(enriched.column("ID").orElseThrow().isNullable());
        assertEquals(2, enriched.rowCount());
        assertEquals("S2", enriched.getRows().get(0).get("ID"));
        assertEquals(41.5, enriched.getRows().get(0).get("TRAVEL_TIME_SECONDS"));
        assertNull(enriched.getRows().get(1).get("ID"));
    }

    @Test
    void shouldListDistinctSortedMembersPerKey() {
        Table rows = new Table(DIMENSION_COLUMNS, List.of(
                dimension("S9", 1L), dimension("S2", 1L), dimension("S9", 1L), dimension("S4", 2L)));

        Map<String, Map<String, Object>> index = assembler.indexWithMembers(rows, "XD", "ID", "MEMBERS");

        assertEquals("S2, S9", index.get("1").get("MEMBERS"));
        assertEquals("S4", index.get("2").get("MEMBERS"));
        assertEquals("S9", index.get("1").get("ID"));
    }

    private static Table dimensions(int count) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (long xd = 1; xd <= count; xd++) {
            rows.add(dimension("S" + xd, xd));
        }
        return new Table(DIMENSION_COLUMNS, rows);
    }

    private static Map<String, Object> dimension(String signalId, long xd) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("ID", signalId);
        row.put("XD", xd);
        row.put("ROADNAME", null);
        return row;
    }

    private static Map<String, Object> aggregate(Object xd, double avg, long records) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("XD", xd);
        row.put("AVG_TRAVEL_TIME", avg);
        row.put("RECORD_COUNT", records);
        return row;
    }
}
