package com.company.signalanalytics.repository;

import com.company.signalanalytics.domain.DimensionEntity;
import com.company.signalanalytics.domain.Table;
import com.company.signalanalytics.query.ColumnRef;
import com.company.signalanalytics.query.Join;
import com.company.signalanalytics.query.ResolvedEntities;
import com.company.signalanalytics.query.SelectQuery;
import com.company.signalanalytics.query.SqlRenderer;
import com.company.signalanalytics.util.RowValues;
import com.company.signalanalytics.warehouse.WarehouseQueryExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.company.signalanalytics.query.WarehouseTables.DIMENSION_ALIAS;
import static com.company.signalanalytics.query.WarehouseTables.DIM_SIGNALS;
import static com.company.signalanalytics.query.WarehouseTables.DIM_SIGNALS_XD;
import static com.company.signalanalytics.query.WarehouseTables.SIGNAL_ALIAS;

/**
 * Dimension pass: the located signal/segment rows matching an entity
 * restriction. This row set is the universe summaries are assembled over.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class DimensionRepository {

    static final List<String> DIMENSION_COLUMNS = List.of(
            "ID", "XD", "LATITUDE", "LONGITUDE", "APPROACH", "VALID_GEOMETRY",
            "BEARING", "COUNTY", "ROADNAME", "MILES", "EXTENDED");

    static final List<String> SIGNAL_COLUMNS = List.of(
            "ID", "DISTRICT", "LATITUDE", "LONGITUDE", "ODOT_MAINTAINED", "NAME");

    static final String MAINTAINED_COLUMN = "ODOT_MAINTAINED";

    private final WarehouseQueryExecutor queryExecutor;
    private final SqlRenderer sqlRenderer;

    public Table findDimensionRows(ResolvedEntities entities) {
        Table rows = queryExecutor.execute("dimension-rows", sqlRenderer.render(dimensionQuery(entities).build()));
        log.debug("Dimension pass returned {} rows for {} selection", rows.rowCount(), entities.getStrategy());
        return rows;
    }

    /**
     * Typed dimension rows, each carrying the maintainer flag of its signal.
     * Rows whose signal is missing from the signal table keep a null flag.
     */
    public List<DimensionEntity> findEntities(ResolvedEntities entities) {
        SelectQuery query = dimensionQuery(entities)
                .join(Join.leftOuter(DIM_SIGNALS, SIGNAL_ALIAS,
                        ColumnRef.of(SIGNAL_ALIAS, "ID"), ColumnRef.of(DIMENSION_ALIAS, "ID")))
                .column(SIGNAL_ALIAS + "." + MAINTAINED_COLUMN)
                .build();
        return toEntities(queryExecutor.execute("dimension-entities", sqlRenderer.render(query)));
    }

    /**
     * The signal table itself, one row per signal, located or not.
     */
    public Table findSignals() {
        SelectQuery.SelectQueryBuilder query = SelectQuery.builder()
                .fromTable(DIM_SIGNALS)
                .fromAlias(SIGNAL_ALIAS)
                .orderBy(SIGNAL_ALIAS + ".ID");
        SIGNAL_COLUMNS.forEach(c -> query.column(SIGNAL_ALIAS + "." + c));
        return queryExecutor.execute("dim-signals", sqlRenderer.render(query.build()));
    }

    private SelectQuery.SelectQueryBuilder dimensionQuery(ResolvedEntities entities) {
        SelectQuery.SelectQueryBuilder query = SelectQuery.builder()
                .fromTable(DIM_SIGNALS_XD)
                .fromAlias(DIMENSION_ALIAS)
                .joins(entities.dimensionJoins(DIMENSION_ALIAS, SIGNAL_ALIAS))
                .where(entities.dimensionCondition(DIMENSION_ALIAS, SIGNAL_ALIAS))
                .orderBy(DIMENSION_ALIAS + ".ID")
                .orderBy(DIMENSION_ALIAS + ".XD");
        DIMENSION_COLUMNS.forEach(c -> query.column(DIMENSION_ALIAS + "." + c));
        return query;
    }

    static List<DimensionEntity> toEntities(Table rows) {
        List<DimensionEntity> entities = new ArrayList<>(rows.rowCount());
        for (Map<String, Object> row : rows.getRows()) {
            entities.add(DimensionEntity.builder()
                    .signalId(RowValues.asString(row.get("ID")))
                    .xd(RowValues.asLong(row.get("XD")))
                    .latitude(RowValues.asDouble(row.get("LATITUDE")))
                    .longitude(RowValues.asDouble(row.get("LONGITUDE")))
                    .approach(RowValues.asBoolean(row.get("APPROACH")))
                    .validGeometry(RowValues.asBoolean(row.get("VALID_GEOMETRY")))
                    .bearing(RowValues.asString(row.get("BEARING")))
                    .county(RowValues.asString(row.get("COUNTY")))
                    .roadName(RowValues.asString(row.get("ROADNAME")))
                    .miles(RowValues.asDouble(row.get("MILES")))
                    .extended(RowValues.asBoolean(row.get("EXTENDED")))
                    .odotMaintained(RowValues.asBoolean(row.get(MAINTAINED_COLUMN)))
                    .build());
        }
        return entities;
    }
}
