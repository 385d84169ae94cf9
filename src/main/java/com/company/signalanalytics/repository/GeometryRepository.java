package com.company.signalanalytics.repository;

import com.company.signalanalytics.cache.SingleFlightCache;
import com.company.signalanalytics.domain.Table;
import com.company.signalanalytics.query.NotNullPredicate;
import com.company.signalanalytics.query.ColumnRef;
import com.company.signalanalytics.query.SelectQuery;
import com.company.signalanalytics.query.SqlRenderer;
import com.company.signalanalytics.warehouse.WarehouseQueryExecutor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.Map;

import static com.company.signalanalytics.query.WarehouseTables.XD_GEOM;

/**
 * Segment geometries as one GeoJSON FeatureCollection, loaded once and
 * shared until invalidated.
 */
@Repository
@Slf4j
public class GeometryRepository {

    private static final String ALIAS = "g";

    private final WarehouseQueryExecutor queryExecutor;
    private final SqlRenderer sqlRenderer;
    private final ObjectMapper objectMapper;
    private final SingleFlightCache<ObjectNode> cache;

    public GeometryRepository(WarehouseQueryExecutor queryExecutor, SqlRenderer sqlRenderer,
                              ObjectMapper objectMapper) {
        this.queryExecutor = queryExecutor;
        this.sqlRenderer = sqlRenderer;
        this.objectMapper = objectMapper;
        this.cache = new SingleFlightCache<>("xd-geometry", this::loadFeatureCollection);
    }

    public ObjectNode getFeatureCollection() {
        return cache.get();
    }

    public void invalidate() {
        cache.invalidate();
    }

    public boolean isLoaded() {
        return cache.isLoaded();
    }

    private ObjectNode loadFeatureCollection() {
        SelectQuery query = SelectQuery.builder()
                .column(ALIAS + ".XD")
                .column("ST_ASGEOJSON(" + ALIAS + ".GEOM) AS GEOJSON")
                .fromTable(XD_GEOM)
                .fromAlias(ALIAS)
                .where(NotNullPredicate.notNull(ColumnRef.of(ALIAS, "GEOM")))
                .build();
        Table rows = queryExecutor.execute("xd-geometry", sqlRenderer.render(query));

        ObjectNode collection = objectMapper.createObjectNode();
        collection.put("type", "FeatureCollection");
        ArrayNode features = collection.putArray("features");

        int skipped = 0;
        for (Map<String, Object> row : rows.getRows()) {
            Object geoJson = row.get("GEOJSON");
            if (geoJson == null || geoJson.toString().isBlank()) {
                skipped++;
                continue;
            }
            JsonNode geometry;
            try {
                geometry = objectMapper.readTree(geoJson.toString());
            } catch (JsonProcessingException e) {
                log.warn("Skipping unparsable geometry for XD {}: {}", row.get("XD"), e.getOriginalMessage());
                skipped++;
                continue;
            }
            ObjectNode feature = features.addObject();
            feature.put("type", "Feature");
            feature.putObject("properties").putPOJO("XD", row.get("XD"));
            feature.set("geometry", geometry);
        }

        log.info("Built geometry collection with {} features ({} skipped)", features.size(), skipped);
        return collection;
    }
}
